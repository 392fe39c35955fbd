package symsat.solver;

import java.util.*;

/**
 * A model of a byte-valued array: explicit bytes at some addresses and one
 * default byte everywhere else. Addresses are unsigned 64-bit values and are
 * ordered as such.
 */
public final class DecodedArray {
  private static final DecodedArray EMPTY = new DecodedArray(Map.of(), 0);

  private final SortedMap<Long, Integer> contents;
  private final int defaultValue;

  public DecodedArray(Map<Long, Integer> contents, int defaultValue) {
    checkByte(defaultValue, "default");
    final SortedMap<Long, Integer> copy = new TreeMap<>(Long::compareUnsigned);
    for (Map.Entry<Long, Integer> entry : contents.entrySet()) {
      checkByte(entry.getValue(), Long.toUnsignedString(entry.getKey(), 16));
      copy.put(entry.getKey(), entry.getValue());
    }
    this.contents = Collections.unmodifiableSortedMap(copy);
    this.defaultValue = defaultValue;
  }

  public static DecodedArray empty() {
    return EMPTY;
  }

  private static void checkByte(int value, String where) {
    if (value < 0 || value > 0xff)
      throw new IllegalArgumentException("value " + value + " at " + where + " is not a byte");
  }

  /** The explicitly mapped addresses, in unsigned order. */
  public SortedMap<Long, Integer> contents() {
    return contents;
  }

  public int defaultValue() {
    return defaultValue;
  }

  public int valueAt(long address) {
    return contents.getOrDefault(address, defaultValue);
  }

  public boolean isEmpty() {
    return contents.isEmpty() && defaultValue == 0;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof DecodedArray)) return false;
    final DecodedArray that = (DecodedArray) obj;
    return defaultValue == that.defaultValue && contents.equals(that.contents);
  }

  @Override
  public int hashCode() {
    return 31 * contents.hashCode() + defaultValue;
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder("{");
    for (Map.Entry<Long, Integer> entry : contents.entrySet()) {
      builder.append(Long.toUnsignedString(entry.getKey(), 16))
          .append("->")
          .append(Integer.toHexString(entry.getValue()))
          .append(", ");
    }
    return builder.append("else->").append(Integer.toHexString(defaultValue)).append('}').toString();
  }
}
