package io.switchboard.core.conversion;

final class StopReasons {

    private StopReasons() {
    }

    static String toFinishReason(String stopReason) {
        if (stopReason == null || stopReason.isBlank()) {
            return "stop";
        }
        return switch (stopReason) {
            case "tool_use" -> "tool_calls";
            case "max_tokens" -> "length";
            default -> "stop";
        };
    }

    static String toStopReason(String finishReason) {
        if (finishReason == null || finishReason.isBlank()) {
            return "end_turn";
        }
        return switch (finishReason) {
            case "tool_calls", "function_call" -> "tool_use";
            case "length" -> "max_tokens";
            default -> "end_turn";
        };
    }
}
