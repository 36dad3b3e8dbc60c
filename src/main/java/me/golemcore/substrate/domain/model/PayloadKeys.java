package me.golemcore.substrate.domain.model;

/**
 * Keys used in ledger entry payloads. Replay reads entries back through the
 * same keys, so renaming one breaks existing ledgers.
 */
public final class PayloadKeys {

    public static final String AGENT_ID = "agentId";
    public static final String AGENT_TYPE = "agentType";
    public static final String OPERATION = "operation";
    public static final String STATUS = "status";
    public static final String REQUIRED_PRIVILEGE = "requiredPrivilege";
    public static final String PRIVILEGE = "privilege";
    public static final String REASON = "reason";

    public static final String ACTION_KIND = "actionKind";
    public static final String COST = "cost";
    public static final String DETAILS = "details";
    public static final String INTENT_SEQUENCE = "intentSequence";
    public static final String SUCCESS = "success";
    public static final String RESULT = "result";

    public static final String AMOUNT = "amount";
    public static final String ALLOCATION = "allocation";
    public static final String ALLOCATED = "allocated";
    public static final String REMAINING = "remaining";
    public static final String COST_TYPE = "costType";
    public static final String WINDOW_ENDS_AT = "windowEndsAt";

    public static final String REQUEST_ID = "requestId";
    public static final String FROM_MODE = "fromMode";
    public static final String TARGET_MODE = "targetMode";
    public static final String JUSTIFICATION = "justification";
    public static final String RESOLUTION = "resolution";
    public static final String DENIAL_KIND = "denialKind";
    public static final String CONFLICT_ID = "conflictId";
    public static final String CONFLICT_TYPE = "conflictType";
    public static final String AGENT_IDS = "agentIds";

    public static final String RULE = "rule";
    public static final String EXPIRES_AT = "expiresAt";
    public static final String CHECKPOINT_ID = "checkpointId";
    public static final String TARGET_SEQUENCE = "targetSequence";
    public static final String DESCRIPTION = "description";
    public static final String FLAG_ID = "flagId";
    public static final String SIGNAL = "signal";
    public static final String DEADLINE = "deadline";
    public static final String VERDICT = "verdict";

    private PayloadKeys() {
    }

    public static String string(LedgerEntry entry, String key) {
        Object value = entry.payload().get(key);
        return value == null ? null : value.toString();
    }

    public static long number(LedgerEntry entry, String key) {
        Object value = entry.payload().get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            return Long.parseLong(text);
        }
        return 0L;
    }
}
