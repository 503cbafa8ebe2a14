/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.server.engine;

import java.util.Map;

/**
 * Verdict of a {@link UserCallback}: whether to acknowledge the message, and what (if
 * anything) it contributes to the results.
 */
public final class CallbackResult {

    private enum Outcome { REPLACED, UNCHANGED, EXCLUDED, REJECTED }

    private static final CallbackResult UNCHANGED = new CallbackResult(Outcome.UNCHANGED, null);
    private static final CallbackResult EXCLUDED = new CallbackResult(Outcome.EXCLUDED, null);
    private static final CallbackResult REJECTED = new CallbackResult(Outcome.REJECTED, null);

    private final Outcome outcome;
    private final Map<String, Object> result;

    private CallbackResult(Outcome outcome, Map<String, Object> result) {
        this.outcome = outcome;
        this.result = result;
    }

    /** Acknowledge and collect {@code result} in place of the record; {@code null} excludes. */
    public static CallbackResult accept(Map<String, Object> result) {
        return result != null ? new CallbackResult(Outcome.REPLACED, result) : EXCLUDED;
    }

    /** Acknowledge and collect the record itself. */
    public static CallbackResult acceptUnchanged() { return UNCHANGED; }

    /** Acknowledge without counting or collecting. */
    public static CallbackResult exclude() { return EXCLUDED; }

    /** Negatively acknowledge, making the message eligible for redelivery. */
    public static CallbackResult reject() { return REJECTED; }

    public boolean ack() { return outcome != Outcome.REJECTED; }

    public boolean excluded() { return outcome == Outcome.EXCLUDED; }

    /** The value to collect: the replacement if one was given, otherwise {@code record}. */
    public Map<String, Object> resultOr(Map<String, Object> record) {
        return outcome == Outcome.REPLACED ? result : record;
    }

    @Override
    public String toString() {
        return "CallbackResult{" + outcome + "}";
    }
}
