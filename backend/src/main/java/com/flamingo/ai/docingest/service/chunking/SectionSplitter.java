package com.flamingo.ai.docingest.service.chunking;

import com.flamingo.ai.docingest.service.model.MarkdownSection;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Partitions raw Markdown into {@link MarkdownSection}s at ATX header boundaries.
 *
 * <p>Lines are scanned top to bottom while tracking a {@link FenceState}. A line whose trimmed
 * form starts with a triple backtick toggles the state and always stays in the current section.
 * Header-looking lines inside a fenced region (shell comments, Python comments) never open a new
 * section. An unterminated fence disables header detection for the rest of the input.
 */
@Component
@Slf4j
public class SectionSplitter {

  private static final Pattern ATX_HEADER = Pattern.compile("#{1,6}\\s+.*", Pattern.DOTALL);

  /**
   * Splits the text into sections in document order.
   *
   * @param text Markdown text, may be empty
   * @return ordered sections; empty when the text is null, empty or blank
   */
  public List<MarkdownSection> split(String text) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }

    List<MarkdownSection> sections = new ArrayList<>();
    List<String> currentLines = new ArrayList<>();
    String currentHeader = "";
    FenceState state = FenceState.IN_PROSE;

    for (String line : text.split("\n", -1)) {
      if (line.strip().startsWith(FenceScanner.FENCE)) {
        state = state.toggle();
        currentLines.add(line);
        continue;
      }

      if (state.allowsHeaders() && ATX_HEADER.matcher(line).matches()) {
        emit(sections, currentHeader, currentLines);
        currentHeader = line.strip();
        currentLines = new ArrayList<>();
      }
      currentLines.add(line);
    }
    emit(sections, currentHeader, currentLines);

    if (state == FenceState.IN_FENCE) {
      log.debug("Unterminated code fence; header detection stayed disabled until end of input");
    }
    log.debug("Split {} chars into {} sections", text.length(), sections.size());
    return sections;
  }

  private void emit(List<MarkdownSection> sections, String header, List<String> lines) {
    String sectionText = String.join("\n", lines).strip();
    if (!sectionText.isEmpty()) {
      sections.add(new MarkdownSection(header, sectionText));
    }
  }
}
