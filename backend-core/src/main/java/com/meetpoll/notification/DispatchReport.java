package com.meetpoll.notification;

import com.meetpoll.domain.enums.DeliveryStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a fan-out, reported next to an otherwise successful mutation
 * ("invitations: 3 ok / 1 failed").
 */
public record DispatchReport(int delivered, int simulated, int failed, List<String> failedRecipients) {

    public DispatchReport {
        failedRecipients = failedRecipients == null ? List.of() : List.copyOf(failedRecipients);
    }

    public static DispatchReport empty() {
        return new DispatchReport(0, 0, 0, List.of());
    }

    public int attempted() {
        return delivered + simulated + failed;
    }

    public int succeeded() {
        return delivered + simulated;
    }

    public boolean hasFailures() {
        return failed > 0;
    }

    public static final class Tally {
        private int delivered;
        private int simulated;
        private final List<String> failed = new ArrayList<>();

        public void record(String recipient, DeliveryStatus status) {
            switch (status) {
                case DELIVERED -> delivered++;
                case SIMULATED -> simulated++;
                case FAILED -> failed.add(recipient);
            }
        }

        public DispatchReport toReport() {
            return new DispatchReport(delivered, simulated, failed.size(), failed);
        }
    }
}
