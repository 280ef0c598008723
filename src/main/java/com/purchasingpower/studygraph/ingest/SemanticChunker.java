package com.purchasingpower.studygraph.ingest;

import com.google.common.base.Preconditions;
import com.purchasingpower.studygraph.core.Chunk;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Heading-aware chunker for extracted study text.
 *
 * <p>Lines are grouped under the most recent heading. Each chunk starts with its heading line, so a
 * section that has to be split for length repeats the heading at the top of every piece. Over-long
 * lines are cut near a sentence end. Chunks stay within {@code maxChars} plus a bounded overshoot
 * (at most 200 characters for budgets above a couple of hundred characters).
 */
@Component
public class SemanticChunker {

    static final int MAX_HEADING_LENGTH = 80;
    static final int SENTENCE_WINDOW = 200;
    static final int WORD_WINDOW = 100;
    static final int LONG_LINE_RESERVE = 100;
    static final int SOFT_BUFFER = 500;
    static final int SOFT_LOOKBACK = 100;

    private static final Pattern NUMBERED_HEADING = Pattern.compile("^\\d+(\\.\\d+)*\\s+.*");

    /**
     * Chunk texts only.
     */
    public List<String> chunk(String text, int maxChars) {
        return split(text, maxChars).stream()
                .map(Chunk::getText)
                .collect(Collectors.toList());
    }

    /**
     * @param maxChars positive size budget per chunk
     * @return chunks in document order; empty for null or blank input
     */
    public List<Chunk> split(String text, int maxChars) {
        Preconditions.checkArgument(maxChars > 0, "maxChars must be positive but was %s", maxChars);
        if (text == null || text.isBlank()) {
            return List.of();
        }

        Accumulator acc = new Accumulator(maxChars);
        for (String raw : text.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty()) {
                continue;
            }
            if (isHeading(line)) {
                acc.startSection(line);
            } else {
                acc.addBodyLine(line);
            }
        }
        acc.finish();
        return acc.chunks;
    }

    /**
     * A line of at most 80 characters that is all upper-case, starts with a dotted number
     * ("14.1 Pricing"), or is title-case without a trailing period.
     */
    public boolean isHeading(String line) {
        if (line == null) {
            return false;
        }
        String trimmed = line.strip();
        if (trimmed.isEmpty() || trimmed.length() > MAX_HEADING_LENGTH) {
            return false;
        }
        if (isUpperCase(trimmed)) {
            return true;
        }
        if (NUMBERED_HEADING.matcher(trimmed).matches()) {
            return true;
        }
        return isTitleCase(trimmed) && !trimmed.endsWith(".");
    }

    /**
     * At least one cased character and no lower-case ones.
     */
    static boolean isUpperCase(String s) {
        boolean cased = false;
        for (int i = 0; i < s.length(); ) {
            int cp = s.codePointAt(i);
            if (Character.isLowerCase(cp)) {
                return false;
            }
            if (Character.isUpperCase(cp) || Character.isTitleCase(cp)) {
                cased = true;
            }
            i += Character.charCount(cp);
        }
        return cased;
    }

    /**
     * Every run of cased characters starts with an upper-case letter followed only by lower-case ones.
     */
    static boolean isTitleCase(String s) {
        boolean cased = false;
        boolean previousCased = false;
        for (int i = 0; i < s.length(); ) {
            int cp = s.codePointAt(i);
            if (Character.isUpperCase(cp) || Character.isTitleCase(cp)) {
                if (previousCased) {
                    return false;
                }
                previousCased = true;
                cased = true;
            } else if (Character.isLowerCase(cp)) {
                if (!previousCased) {
                    return false;
                }
                previousCased = true;
                cased = true;
            } else {
                previousCased = false;
            }
            i += Character.charCount(cp);
        }
        return cased;
    }

    /**
     * Splits {@code text} into a head of roughly {@code budget} characters and the remainder.
     * Prefers the last sentence terminator within 200 characters either side of the budget, then
     * the last space in the 100 characters before it, then a hard cut.
     */
    static String[] breakAtSentenceBoundary(String text, int budget) {
        if (text.length() <= budget) {
            return new String[]{text, ""};
        }
        int from = Math.min(budget + SENTENCE_WINDOW - 1, text.length() - 1);
        int to = Math.max(budget - SENTENCE_WINDOW, 0);
        for (int i = from; i > to; i--) {
            if (isSentenceEnd(text.charAt(i))) {
                return cut(text, i + 1);
            }
        }
        for (int i = Math.min(budget, text.length() - 1); i > Math.max(0, budget - WORD_WINDOW); i--) {
            if (text.charAt(i) == ' ') {
                return cut(text, i);
            }
        }
        return cut(text, budget);
    }

    private static String[] cut(String text, int at) {
        return new String[]{text.substring(0, at).strip(), text.substring(at).strip()};
    }

    private static boolean isSentenceEnd(char c) {
        return c == '.' || c == '!' || c == '?';
    }

    /**
     * Mutable state of one {@link #split} run.
     */
    private static final class Accumulator {
        private final int maxChars;
        private final List<Chunk> chunks = new ArrayList<>();
        private final StringBuilder current = new StringBuilder();
        private String heading;
        private boolean hasBody;
        private boolean headingEmitted = true;
        private String pending = "";

        Accumulator(int maxChars) {
            this.maxChars = maxChars;
        }

        void startSection(String newHeading) {
            drainPending();
            flush();
            heading = newHeading;
            headingEmitted = false;
            reseed();
        }

        void addBodyLine(String line) {
            if (!pending.isEmpty()) {
                line = pending + " " + line;
                pending = "";
            }
            append(line);
        }

        void finish() {
            drainPending();
            flush();
        }

        private void append(String line) {
            if (current.length() + line.length() + 1 > maxChars && hasBody) {
                flush();
            }

            if (line.length() > maxChars) {
                int budget = maxChars - current.length() - LONG_LINE_RESERVE;
                if (budget <= 0) {
                    budget = maxChars;
                }
                String[] parts = breakAtSentenceBoundary(line, budget);
                current.append(parts[0]).append(' ');
                hasBody = true;
                flush();
                pending = parts[1];
                return;
            }

            current.append(line).append(' ');
            hasBody = true;
            if (current.length() >= maxChars - SOFT_BUFFER) {
                softBreak();
            }
        }

        private void softBreak() {
            int length = current.length();
            int start = Math.max(length - SOFT_LOOKBACK, prefixLength());
            int breakPoint = -1;
            for (int i = start; i < length; i++) {
                if (isSentenceEnd(current.charAt(i))) {
                    breakPoint = i + 1;
                    break;
                }
            }
            if (breakPoint < 0 || breakPoint >= length) {
                return;
            }
            String head = current.substring(0, breakPoint).strip();
            String rest = current.substring(breakPoint).strip();
            emit(head);
            reseed();
            if (!rest.isEmpty()) {
                current.append(rest).append(' ');
                hasBody = true;
            }
        }

        private void drainPending() {
            while (!pending.isEmpty()) {
                String fragment = pending;
                pending = "";
                append(fragment);
            }
        }

        private void flush() {
            String text = current.toString().strip();
            if (!text.isEmpty() && (hasBody || !headingEmitted)) {
                emit(text);
            }
            reseed();
        }

        private void emit(String text) {
            chunks.add(new Chunk(text, heading, chunks.size()));
            headingEmitted = true;
        }

        private void reseed() {
            current.setLength(0);
            if (heading != null) {
                current.append(heading).append('\n');
            }
            hasBody = false;
        }

        private int prefixLength() {
            return heading == null ? 0 : heading.length() + 1;
        }
    }
}
