package eu.virtualparadox.ewexport.export;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts section content into slides.
 *
 * <p>Blank lines separate natural slides. A natural slide longer than the line limit is cut into
 * consecutive chunks of at most that many lines when auto-breaking is on, and kept whole otherwise.
 * Lines are trimmed.</p>
 */
@Component
public class SlideSplitter {

    public List<String> split(final String content, final ExportOptions options) {
        return split(content, options.maxLinesPerSlide(), options.autoBreakLongLines());
    }

    public List<String> split(final String content, final int maxLinesPerSlide, final boolean autoBreak) {
        if (maxLinesPerSlide <= 0) {
            throw new IllegalArgumentException("maxLinesPerSlide must be positive");
        }

        final List<String> slides = new ArrayList<>();
        if (content == null) {
            return slides;
        }

        List<String> current = new ArrayList<>();
        for (final String rawLine : content.split("\n", -1)) {
            final String line = rawLine.strip();
            if (line.isEmpty()) {
                addSlides(slides, current, maxLinesPerSlide, autoBreak);
                current = new ArrayList<>();
            } else {
                current.add(line);
            }
        }
        addSlides(slides, current, maxLinesPerSlide, autoBreak);

        return slides;
    }

    private void addSlides(final List<String> slides,
                           final List<String> lines,
                           final int maxLinesPerSlide,
                           final boolean autoBreak) {
        if (lines.isEmpty()) {
            return;
        }
        if (!autoBreak || lines.size() <= maxLinesPerSlide) {
            slides.add(String.join("\n", lines));
            return;
        }
        for (int start = 0; start < lines.size(); start += maxLinesPerSlide) {
            final int end = Math.min(start + maxLinesPerSlide, lines.size());
            slides.add(String.join("\n", lines.subList(start, end)));
        }
    }
}
