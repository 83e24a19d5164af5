package com.flamingo.ai.contractsplitter.agent;

import com.flamingo.ai.contractsplitter.agent.dto.HeadingClassifications;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that labels contract and statute fragments as headings or body text.
 *
 * <p>Levels follow the legal hierarchy used by the rule-based classifier, so LLM and pattern
 * results can be mixed within one document.
 */
public interface HeadingClassificationAgent {

  @SystemMessage(
      """
        You are an expert in the structure of legal documents, contracts and regulations.
        For each numbered text fragment decide whether it is a structural heading and, if so,
        its hierarchy level.

        Levels:
        1 = book (编), 2 = part (篇, Part), 3 = chapter (章, Chapter),
        4 = section (节, Section, §), 5 = article (条, Article),
        6 = clause (款), 7 = item (项), 8 = sub-item (目), 9 = paragraph,
        10 = enumeration such as （一） or (1) or ①, 11 = numbering such as 1. or 1.1

        Rules:
        - A fragment that states obligations, definitions or other body text is not a heading,
          even if it starts with an article number.
        - Headings are short and rarely end with sentence punctuation.
        - For non-headings use level 10.

        Return a JSON object with a "results" array holding exactly one entry per fragment, in
        order. Each entry has "isHeading" (boolean), "level" (integer 1-11) and "confidence"
        (0.0-1.0).
        Example: {"results": [{"isHeading": true, "level": 3, "confidence": 0.95},
        {"isHeading": false, "level": 10, "confidence": 0.9}]}
        """)
  @UserMessage("""
        Fragments ({{count}} in total):
        {{fragments}}
        """)
  HeadingClassifications classify(@V("count") int count, @V("fragments") String fragments);
}
