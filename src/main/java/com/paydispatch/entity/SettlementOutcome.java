package com.paydispatch.entity;

import java.util.Objects;

public record SettlementOutcome(Status status, Processor processor) {

    public enum Status {
        SETTLED,
        ALREADY_SETTLED,
        UNRECORDED,
        DROPPED
    }

    public SettlementOutcome {
        Objects.requireNonNull(status, "status");
        if ((status == Status.SETTLED || status == Status.UNRECORDED) && processor == null) {
            throw new IllegalArgumentException(status + " requires a processor");
        }
    }

    public static SettlementOutcome settled(Processor processor) {
        return new SettlementOutcome(Status.SETTLED, processor);
    }

    public static SettlementOutcome unrecorded(Processor processor) {
        return new SettlementOutcome(Status.UNRECORDED, processor);
    }

    public static SettlementOutcome alreadySettled() {
        return new SettlementOutcome(Status.ALREADY_SETTLED, null);
    }

    public static SettlementOutcome dropped() {
        return new SettlementOutcome(Status.DROPPED, null);
    }
}
