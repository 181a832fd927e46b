package com.agentsearch.util;

import com.agentsearch.dto.internal.Chunk;
import com.agentsearch.dto.internal.ChunkingStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits document text into overlapping, boundary-aware chunks for indexing.
 * <p>
 * Pure and deterministic: the same input and parameters always give the same
 * chunks. Work happens on a whitespace-normalized copy of the text (see
 * {@link #normalize}); chunk offsets index into that copy. No chunk is longer
 * than {@code size}: sentences or paragraphs that are longer on their own are
 * first cut into word-aligned, overlapping pieces.
 */
@Slf4j
@Component
public class TextSegmenter {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");

    static final String PARAGRAPH_SEPARATOR = "\n\n";

    public List<Chunk> chunk(String text, int size, int overlap, String strategy) {
        return chunk(text, size, overlap, ChunkingStrategy.from(strategy));
    }

    public List<Chunk> chunk(String text, int size, int overlap, ChunkingStrategy strategy) {
        ChunkingStrategy s = strategy != null ? strategy : ChunkingStrategy.SENTENCE;
        String normalized = normalize(text, s);
        if (normalized.isEmpty()) {
            return List.of();
        }

        int chunkSize = Math.max(1, size);
        int chunkOverlap = Math.max(0, Math.min(overlap, chunkSize - 1));

        List<Chunk> chunks = switch (s) {
            case PARAGRAPH -> accumulate(normalized, paragraphUnits(normalized, chunkSize, chunkOverlap), chunkSize, chunkOverlap, true);
            case FIXED -> fixedWindows(normalized, chunkSize, chunkOverlap);
            case SENTENCE -> accumulate(normalized, sentenceUnits(normalized, chunkSize, chunkOverlap), chunkSize, chunkOverlap, false);
        };

        log.debug("Chunked {} chars into {} {} chunks (size={}, overlap={})",
            normalized.length(), chunks.size(), s.getValue(), chunkSize, chunkOverlap);
        return chunks;
    }

    /**
     * Paragraph strategy keeps paragraph breaks (collapsed to one blank line);
     * the other strategies collapse every whitespace run to a single space.
     */
    public String normalize(String text, ChunkingStrategy strategy) {
        if (text == null || text.isBlank()) {
            return "";
        }

        if (strategy == ChunkingStrategy.PARAGRAPH) {
            List<String> paragraphs = new ArrayList<>();
            for (String p : PARAGRAPH_BREAK.split(text)) {
                String cleaned = WHITESPACE.matcher(p).replaceAll(" ").trim();
                if (!cleaned.isEmpty()) {
                    paragraphs.add(cleaned);
                }
            }
            return String.join(PARAGRAPH_SEPARATOR, paragraphs);
        }

        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /* ============================================================
       UNITS
       ============================================================ */

    private List<Span> sentenceUnits(String text, int size, int overlap) {
        List<Span> units = new ArrayList<>();
        Matcher m = SENTENCE_END.matcher(text);
        int start = 0;

        while (m.find()) {
            splitOversized(text, new Span(start, m.start()), size, overlap, units);
            start = m.end();
        }
        if (start < text.length()) {
            splitOversized(text, new Span(start, text.length()), size, overlap, units);
        }
        return units;
    }

    private List<Span> paragraphUnits(String text, int size, int overlap) {
        List<Span> units = new ArrayList<>();
        int start = 0;

        while (start < text.length()) {
            int brk = text.indexOf(PARAGRAPH_SEPARATOR, start);
            int end = brk >= 0 ? brk : text.length();
            splitOversized(text, new Span(start, end), size, overlap, units);
            start = end + PARAGRAPH_SEPARATOR.length();
        }
        return units;
    }

    /**
     * Cuts a unit longer than {@code size} at the last space that keeps each piece
     * within size; a single word longer than size is cut hard. Each piece after the
     * first restarts {@code overlap} characters back, at a word start, so the
     * pieces of one unit overlap each other the way fixed windows do.
     */
    private void splitOversized(String text, Span unit, int size, int overlap, List<Span> out) {
        int s = unit.start;

        while (unit.end - s > size) {
            int limit = s + size;
            int cut = text.lastIndexOf(' ', limit);
            if (cut <= s) {
                cut = limit;
            }
            out.add(new Span(s, cut));

            int next = overlap > 0 ? wordAlignedSuffix(text, s, cut, cut - overlap) : -1;
            if (next <= s) {
                next = cut;
                while (next < unit.end && text.charAt(next) == ' ') {
                    next++;
                }
            }
            s = next;
        }

        if (s < unit.end) {
            out.add(new Span(s, unit.end));
        }
    }

    /* ============================================================
       SENTENCE / PARAGRAPH ACCUMULATION
       ============================================================ */

    private List<Chunk> accumulate(String text, List<Span> units, int size, int overlap, boolean wholeUnitOverlap) {
        List<Chunk> chunks = new ArrayList<>();
        List<Span> members = new ArrayList<>();
        int chunkStart = -1;
        int chunkEnd = -1;
        boolean seeded = false;

        for (Span unit : units) {
            if (chunkStart < 0) {
                chunkStart = unit.start;
                chunkEnd = unit.end;
                members.add(unit);
                continue;
            }

            // next piece of an oversized unit: it already overlaps the current chunk
            if (unit.start < chunkEnd) {
                emit(chunks, text, chunkStart, chunkEnd, seeded);
                members = new ArrayList<>(List.of(unit));
                seeded = true;
                chunkStart = unit.start;
                chunkEnd = unit.end;
                continue;
            }

            if (unit.end - chunkStart <= size) {
                chunkEnd = unit.end;
                members.add(unit);
                continue;
            }

            emit(chunks, text, chunkStart, chunkEnd, seeded);

            int seedStart = -1;
            List<Span> carried = new ArrayList<>();
            if (overlap > 0) {
                if (wholeUnitOverlap) {
                    for (int i = members.size() - 1; i >= 0; i--) {
                        Span m = members.get(i);
                        if (chunkEnd - m.start > overlap || unit.end - m.start > size) {
                            break;
                        }
                        seedStart = m.start;
                        carried.add(0, m);
                    }
                } else {
                    seedStart = wordAlignedSuffix(text, chunkStart, chunkEnd,
                        Math.max(chunkEnd - overlap, unit.end - size));
                }
            }

            members = new ArrayList<>(carried);
            members.add(unit);
            seeded = seedStart >= 0;
            chunkStart = seeded ? seedStart : unit.start;
            chunkEnd = unit.end;
        }

        if (chunkStart >= 0) {
            emit(chunks, text, chunkStart, chunkEnd, seeded);
        }
        return chunks;
    }

    /**
     * Start offset of the overlap seed taken from the end of [chunkStart, chunkEnd),
     * no earlier than {@code minStart}, moved forward to the next word start when
     * it would begin mid-word. Returns -1 when nothing fits.
     */
    private int wordAlignedSuffix(String text, int chunkStart, int chunkEnd, int minStart) {
        int w = Math.max(chunkStart, minStart);
        if (w >= chunkEnd) {
            return -1;
        }

        if (w > chunkStart && text.charAt(w - 1) != ' ') {
            int space = text.indexOf(' ', w);
            if (space >= 0 && space + 1 < chunkEnd) {
                w = space + 1;
            }
            // no space left in the window: keep the raw character suffix
        }

        while (w < chunkEnd && text.charAt(w) == ' ') {
            w++;
        }
        return w < chunkEnd ? w : -1;
    }

    /* ============================================================
       FIXED WINDOWS
       ============================================================ */

    private List<Chunk> fixedWindows(String text, int size, int overlap) {
        List<Chunk> chunks = new ArrayList<>();
        int n = text.length();
        int start = 0;
        int previousEnd = -1;

        while (start < n) {
            int end = Math.min(start + size, n);

            // boundary falls mid-word: snap back to the last space inside the window
            if (end < n && text.charAt(end) != ' ' && text.charAt(end - 1) != ' ') {
                int space = text.lastIndexOf(' ', end - 1);
                if (space > start) {
                    end = space;
                }
            }

            int trimmedEnd = end;
            while (trimmedEnd > start && text.charAt(trimmedEnd - 1) == ' ') {
                trimmedEnd--;
            }
            if (trimmedEnd > start) {
                emit(chunks, text, start, trimmedEnd, previousEnd > start);
                previousEnd = trimmedEnd;
            }

            if (end >= n) {
                break;
            }

            int next = end - overlap;
            if (next <= start) {
                next = end;
            }
            if (next < end && next > 0 && text.charAt(next - 1) != ' ') {
                int space = text.indexOf(' ', next);
                if (space >= 0 && space < end) {
                    next = space + 1;
                }
            }
            while (next < n && text.charAt(next) == ' ') {
                next++;
            }
            start = next;
        }

        return chunks;
    }

    private void emit(List<Chunk> chunks, String text, int start, int end, boolean overlapsPrevious) {
        chunks.add(Chunk.builder()
            .index(chunks.size())
            .text(text.substring(start, end))
            .start(start)
            .end(end)
            .overlapsPrevious(overlapsPrevious)
            .build());
    }

    private record Span(int start, int end) {
    }
}
