package com.flowcode.core.execution;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimal line diff (longest common subsequence) rendered with "+"/"-" prefixes.
 */
public final class LineDiff {

    private static final int MAX_LINES = 2_000;

    private LineDiff() {}

    public static String between(String before, String after) {
        List<String> a = lines(before);
        List<String> b = lines(after);
        if (a.size() > MAX_LINES || b.size() > MAX_LINES) {
            return "@@ -" + a.size() + " +" + b.size() + " @@ (diff omitted, file too large)";
        }
        int[][] lcs = new int[a.size() + 1][b.size() + 1];
        for (int i = a.size() - 1; i >= 0; i--) {
            for (int j = b.size() - 1; j >= 0; j--) {
                lcs[i][j] = a.get(i).equals(b.get(j))
                        ? lcs[i + 1][j + 1] + 1
                        : Math.max(lcs[i + 1][j], lcs[i][j + 1]);
            }
        }
        var out = new StringBuilder();
        int i = 0;
        int j = 0;
        while (i < a.size() && j < b.size()) {
            if (a.get(i).equals(b.get(j))) {
                i++;
                j++;
            } else if (lcs[i + 1][j] >= lcs[i][j + 1]) {
                out.append("-").append(a.get(i++)).append('\n');
            } else {
                out.append("+").append(b.get(j++)).append('\n');
            }
        }
        while (i < a.size()) {
            out.append("-").append(a.get(i++)).append('\n');
        }
        while (j < b.size()) {
            out.append("+").append(b.get(j++)).append('\n');
        }
        return out.toString();
    }

    private static List<String> lines(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return new ArrayList<>(List.of(text.split("\n", -1)));
    }
}
