package symsat.common;

import java.math.BigInteger;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

/**
 * A fixed-width bit vector stored as little-endian bytes.
 * Byte 0 holds bits [0, 8), byte 1 holds bits [8, 16), and so on.
 * Bits above {@link #numBits()} in the last byte are always zero.
 */
public class BitVector {
  private final int numBits;
  private final byte[] bytes;

  public BitVector(int numBits) {
    checkArgument(numBits > 0, "non-positive width: %s", numBits);
    this.numBits = numBits;
    this.bytes = new byte[(numBits + 7) / 8];
  }

  public static BitVector of(int numBits, BigInteger value) {
    checkArgument(value.signum() >= 0, "negative value: %s", value);
    checkArgument(value.bitLength() <= numBits, "%s does not fit in %s bits", value, numBits);
    final BitVector bv = new BitVector(numBits);
    for (int i = 0; i < bv.bytes.length; ++i)
      bv.bytes[i] = value.shiftRight(i * 8).byteValue();
    return bv;
  }

  public static BitVector of(int numBits, long value) {
    return of(numBits, toUnsigned(value).and(mask(numBits)));
  }

  public int numBits() {
    return numBits;
  }

  public int numFixedBytes() {
    return bytes.length;
  }

  /** The i-th byte as an unsigned value in [0, 255]. */
  public int getFixedByte(int i) {
    checkElementIndex(i, bytes.length);
    return bytes[i] & 0xff;
  }

  public void setFixedByte(int i, int value) {
    checkElementIndex(i, bytes.length);
    checkArgument(value >= 0 && value <= 0xff, "not a byte: %s", value);
    bytes[i] = (byte) value;
    if (i == bytes.length - 1 && numBits % 8 != 0)
      bytes[i] &= (byte) ((1 << (numBits % 8)) - 1);
  }

  public boolean getBit(int i) {
    checkElementIndex(i, numBits);
    return ((bytes[i / 8] >> (i % 8)) & 1) != 0;
  }

  public BigInteger toBigInteger() {
    BigInteger result = BigInteger.ZERO;
    for (int i = bytes.length - 1; i >= 0; --i)
      result = result.shiftLeft(8).or(BigInteger.valueOf(bytes[i] & 0xff));
    return result;
  }

  /** The low 64 bits, as a two's complement long. */
  public long toLong() {
    return toBigInteger().longValue();
  }

  static BigInteger mask(int numBits) {
    return BigInteger.ONE.shiftLeft(numBits).subtract(BigInteger.ONE);
  }

  private static BigInteger toUnsigned(long value) {
    final BigInteger v = BigInteger.valueOf(value);
    return value >= 0 ? v : v.add(BigInteger.ONE.shiftLeft(64));
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof BitVector)) return false;
    final BitVector that = (BitVector) obj;
    return numBits == that.numBits && Arrays.equals(bytes, that.bytes);
  }

  @Override
  public int hashCode() {
    return 31 * numBits + Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder("0x");
    for (int i = bytes.length - 1; i >= 0; --i)
      builder.append(String.format("%02x", bytes[i] & 0xff));
    return builder.append('[').append(numBits).append(']').toString();
  }
}
