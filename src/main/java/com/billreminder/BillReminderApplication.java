package com.billreminder;

import com.billreminder.config.ReminderProperties;
import com.billreminder.config.TelegramProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({TelegramProperties.class, ReminderProperties.class})
public class BillReminderApplication {

    public static void main(String[] args) {
        SpringApplication.run(BillReminderApplication.class, args);
    }
}
