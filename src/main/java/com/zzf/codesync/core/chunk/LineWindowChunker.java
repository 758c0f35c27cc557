package com.zzf.codesync.core.chunk;

import com.zzf.codesync.core.util.Sha256;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Packs whole lines into windows bounded by a character and a line budget. Lines are
 * never split: a single line above the character budget becomes its own oversized chunk.
 */
public final class LineWindowChunker implements Chunker {
    private static final Logger logger = LoggerFactory.getLogger(LineWindowChunker.class);

    public static final int DEFAULT_MAX_CHARS = 2000;
    public static final int DEFAULT_MAX_LINES = 200;

    private final int maxChars;
    private final int maxLines;

    public LineWindowChunker() {
        this(DEFAULT_MAX_CHARS, DEFAULT_MAX_LINES);
    }

    public LineWindowChunker(int maxChars, int maxLines) {
        if (maxChars <= 0 || maxLines <= 0) {
            throw new IllegalArgumentException("chunk budget must be positive maxChars=" + maxChars + " maxLines=" + maxLines);
        }
        this.maxChars = maxChars;
        this.maxLines = maxLines;
    }

    public int getMaxChars() {
        return maxChars;
    }

    public int getMaxLines() {
        return maxLines;
    }

    @Override
    public List<Chunk> chunk(String path, String content) {
        return chunk(path, content, Collections.<Integer>emptySet());
    }

    /**
     * @param preferredStarts 1-based line numbers where a new chunk should preferably
     *                        begin once the current one is at least half full
     */
    List<Chunk> chunk(String path, String content, Set<Integer> preferredStarts) {
        List<Chunk> chunks = new ArrayList<Chunk>();
        if (content == null || content.isEmpty()) {
            return chunks;
        }
        List<int[]> lines = lineSpans(content);
        int windowStart = 0;
        int windowChars = 0;
        int windowLines = 0;
        for (int i = 0; i < lines.size(); i++) {
            int len = lines.get(i)[1] - lines.get(i)[0];
            if (windowLines > 0) {
                boolean overflow = windowChars + len > maxChars || windowLines + 1 > maxLines;
                boolean preferCut = preferredStarts.contains(i + 1) && windowChars >= maxChars / 2;
                if (overflow || preferCut) {
                    chunks.add(emit(path, content, lines, windowStart, i - 1, chunks.size(), false));
                    windowStart = i;
                    windowChars = 0;
                    windowLines = 0;
                }
            }
            if (windowLines == 0 && len > maxChars) {
                logger.warn("chunk.oversized path={} line={} chars={} maxChars={}", path, i + 1, len, maxChars);
                chunks.add(emit(path, content, lines, i, i, chunks.size(), true));
                windowStart = i + 1;
                continue;
            }
            windowChars += len;
            windowLines++;
        }
        if (windowLines > 0) {
            chunks.add(emit(path, content, lines, windowStart, lines.size() - 1, chunks.size(), false));
        }
        return chunks;
    }

    private static Chunk emit(String path, String content, List<int[]> lines, int firstLine, int lastLine, int index, boolean oversized) {
        int start = lines.get(firstLine)[0];
        int end = lines.get(lastLine)[1];
        String text = content.substring(start, end);
        return new Chunk(path, index, firstLine + 1, lastLine + 1, start, end, Sha256.hex(text), oversized, text);
    }

    // [start, end) of each line, terminator included
    private static List<int[]> lineSpans(String content) {
        List<int[]> spans = new ArrayList<int[]>();
        int start = 0;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                spans.add(new int[]{start, i + 1});
                start = i + 1;
            }
        }
        if (start < content.length()) {
            spans.add(new int[]{start, content.length()});
        }
        return spans;
    }
}
