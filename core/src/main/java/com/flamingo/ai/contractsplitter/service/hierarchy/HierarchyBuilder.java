package com.flamingo.ai.contractsplitter.service.hierarchy;

import com.flamingo.ai.contractsplitter.model.Element;
import com.flamingo.ai.contractsplitter.model.Section;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds a section forest from classified elements in a single pass.
 *
 * <p>Open sections are kept on a stack ordered by level. A heading at level {@code L} closes every
 * open section at level {@code >= L} and opens a new one under whatever remains on top, so each
 * child is strictly deeper than its parent. Body text is appended to the innermost open section;
 * body text seen before the first heading goes into a synthetic {@value #SYNTHETIC_ROOT_HEADING}
 * section at level 1.
 *
 * <p>Elements must already carry their heading flag and level; this class never classifies.
 */
@Service
@Slf4j
public class HierarchyBuilder {

  public static final String SYNTHETIC_ROOT_HEADING = "Document Content";
  public static final int SYNTHETIC_ROOT_LEVEL = 1;

  static final String CONTENT_SEPARATOR = "\n\n";

  public List<Section> build(List<Element> elements) {
    if (elements == null || elements.isEmpty()) {
      return List.of();
    }

    List<SectionBuilder> roots = new ArrayList<>();
    Deque<SectionBuilder> stack = new ArrayDeque<>();

    for (Element element : elements) {
      String text = element.text().strip();
      if (text.isEmpty()) {
        continue;
      }

      if (element.heading()) {
        int level = element.level();
        while (!stack.isEmpty() && stack.peek().level >= level) {
          stack.pop();
        }
        SectionBuilder section = new SectionBuilder(text, level);
        section.append(text);
        if (stack.isEmpty()) {
          roots.add(section);
        } else {
          stack.peek().children.add(section);
        }
        stack.push(section);
      } else if (stack.isEmpty()) {
        SectionBuilder root = new SectionBuilder(SYNTHETIC_ROOT_HEADING, SYNTHETIC_ROOT_LEVEL);
        root.append(text);
        roots.add(root);
        stack.push(root);
      } else {
        stack.peek().append(text);
      }
    }

    List<Section> forest = roots.stream().map(SectionBuilder::build).toList();
    log.debug("Built {} root sections from {} elements", forest.size(), elements.size());
    return forest;
  }

  /** Mutable section under construction; frozen into a {@link Section} once the pass ends. */
  private static final class SectionBuilder {
    private final String heading;
    private final int level;
    private final StringBuilder content = new StringBuilder();
    private final List<SectionBuilder> children = new ArrayList<>();

    private SectionBuilder(String heading, int level) {
      this.heading = heading;
      this.level = level;
    }

    private void append(String text) {
      if (content.length() > 0) {
        content.append(CONTENT_SEPARATOR);
      }
      content.append(text);
    }

    private Section build() {
      return new Section(
          heading,
          content.toString(),
          level,
          children.stream().map(SectionBuilder::build).toList());
    }
  }
}
