package com.flamingo.ai.contractsplitter.model;

/** Origin of an {@link Element} inside the source document. */
public enum ElementKind {
  PARAGRAPH,
  TABLE_CELL,
  HEADING
}
