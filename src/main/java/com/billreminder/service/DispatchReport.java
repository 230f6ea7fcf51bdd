package com.billreminder.service;

import com.billreminder.domain.enums.DispatchStatus;

import java.util.List;

public record DispatchReport(List<DispatchResult> sent, List<DispatchResult> failed, List<DispatchResult> skipped) {

    public static DispatchReport empty() {
        return new DispatchReport(List.of(), List.of(), List.of());
    }

    public static DispatchReport of(List<DispatchResult> results) {
        return new DispatchReport(
                results.stream().filter(r -> r.status() == DispatchStatus.SENT).toList(),
                results.stream().filter(r -> r.status().isFailure()).toList(),
                results.stream().filter(r -> r.status() == DispatchStatus.DUPLICATE
                        || r.status() == DispatchStatus.DEFERRED).toList()
        );
    }

    public boolean isEmpty() {
        return sent.isEmpty() && failed.isEmpty() && skipped.isEmpty();
    }
}
