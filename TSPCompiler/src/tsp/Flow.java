package tsp;

/** How the normalizer treats the whitespace around and inside a command. */
public enum Flow {
  INLINE,
  BLOCK,
  STRUCTURED,
  LOCATION,
  NONE
}
