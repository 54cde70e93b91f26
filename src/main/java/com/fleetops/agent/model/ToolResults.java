package com.fleetops.agent.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shapes of the result map attached to a {@link ToolCall}.
 *
 * The orchestrator only inspects {@link #STATUS} to spot a pending confirmation;
 * everything else is handed to the LLM as-is.
 */
public final class ToolResults {

    public static final String STATUS = "status";
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_CONFIRMATION_REQUIRED = "confirmation_required";

    public static final String ERROR = "error";
    public static final String RECOVERABLE = "recoverable";
    public static final String ERROR_TYPE = "error_type";
    public static final String OPERATION_ID = "operation_id";
    public static final String MESSAGE = "message";
    public static final String RISK_LEVEL = "risk_level";
    public static final String RESULT = "result";

    private ToolResults() {
    }

    public static Map<String, Object> success(String operationId, Object result) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(STATUS, STATUS_SUCCESS);
        if (operationId != null) {
            map.put(OPERATION_ID, operationId);
        }
        map.put(RESULT, result);
        return map;
    }

    public static Map<String, Object> data(Object result) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(STATUS, STATUS_SUCCESS);
        map.put(RESULT, result);
        return map;
    }

    public static Map<String, Object> error(String message, boolean recoverable) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(ERROR, message);
        map.put(RECOVERABLE, recoverable);
        return map;
    }

    public static Map<String, Object> error(String message, boolean recoverable, String errorType) {
        Map<String, Object> map = error(message, recoverable);
        map.put(ERROR_TYPE, errorType);
        return map;
    }

    public static Map<String, Object> confirmationRequired(String operationId, String message, String riskLevel) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(STATUS, STATUS_CONFIRMATION_REQUIRED);
        map.put(OPERATION_ID, operationId);
        map.put(MESSAGE, message);
        map.put(RISK_LEVEL, riskLevel);
        return map;
    }

    public static boolean isConfirmationRequired(Map<String, Object> result) {
        return result != null && STATUS_CONFIRMATION_REQUIRED.equals(result.get(STATUS));
    }

    public static boolean isError(Map<String, Object> result) {
        return result != null && result.containsKey(ERROR);
    }
}
