package com.ledgerlens.backend.services.ai;

public final class ModelOutput {

    private ModelOutput() {
    }

    /** Removes a surrounding Markdown code fence (```json ... ```), if any. */
    public static String stripCodeFences(String s) {
        if (s == null) {
            return "";
        }
        String t = s.trim();
        if (!t.startsWith("```")) {
            return t;
        }
        int firstNewline = t.indexOf('\n');
        if (firstNewline < 0) {
            return t.replace("```", "").trim();
        }
        String withoutFirstLine = t.substring(firstNewline + 1);
        int lastFence = withoutFirstLine.lastIndexOf("```");
        if (lastFence >= 0) {
            withoutFirstLine = withoutFirstLine.substring(0, lastFence);
        }
        return withoutFirstLine.trim();
    }

    public static String abbreviate(String s, int max) {
        if (s == null) {
            return "";
        }
        return s.length() > max ? s.substring(0, max) + "..." : s;
    }
}
