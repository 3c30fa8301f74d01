package org.example.nucleicounter.script;

public final class ImageNames {

    private ImageNames() {
    }

    public static String displayName(String identifier) {
        int end = identifier.length();
        while (end > 0 && isSeparator(identifier.charAt(end - 1))) {
            end--;
        }
        int start = end;
        while (start > 0 && !isSeparator(identifier.charAt(start - 1))) {
            start--;
        }
        return identifier.substring(start, end);
    }

    private static boolean isSeparator(char c) {
        return c == '/' || c == '\\';
    }
}
