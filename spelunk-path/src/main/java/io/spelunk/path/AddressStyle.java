package io.spelunk.path;

/** How declaration segments are rendered in a stable path. */
public enum AddressStyle {
  /** Bare declared name: {@code /A/Bar/if[1]}. */
  COMPACT,
  /** Type-qualified declared name: {@code /class[A]/method[Bar]/if[1]}. */
  QUALIFIED
}
