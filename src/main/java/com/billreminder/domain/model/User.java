package com.billreminder.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "users")
public class User extends BaseEntity {

    public static final String DEFAULT_TIMEZONE = "Asia/Ho_Chi_Minh";

    // Telegram chat id, messages are delivered to it directly
    @Id
    private Long id;

    @Column(length = 255)
    private String name;

    @Column(nullable = false, length = 64)
    private String timezone = DEFAULT_TIMEZONE;

    public User(Long id, String name, String timezone) {
        this.id = id;
        this.name = name;
        this.timezone = timezone;
    }
}
