package io.loglogbeta.sketch;

import com.google.common.base.Preconditions;

import java.util.Arrays;

/**
 * Fixed-length array of registers, each holding the largest rank observed for its index.
 *
 * <p>Registers only ever grow: {@link #raise(int, int)} keeps the larger of the current and the
 * candidate rank, and {@link #pointwiseMax(RegisterArray)} combines two arrays index by index.
 *
 * <p>Each register needs 6 bits, we use a {@code byte} per register to keep updates cheap and pack
 * only when the array is written out by {@link #toPackedBytes(byte[], int)}.
 *
 * <p>Not thread-safe.
 */
final class RegisterArray
{
  static final int REGISTER_WIDTH = 6;
  static final int MAX_RANK = (1 << REGISTER_WIDTH) - 1;

  private final byte[] registers;

  RegisterArray(int size)
  {
    Preconditions.checkArgument(size > 0, "invalid size [%s] : should be positive", size);
    this.registers = new byte[size];
  }

  private RegisterArray(byte[] registers)
  {
    this.registers = registers;
  }

  int size()
  {
    return registers.length;
  }

  int get(int index)
  {
    Preconditions.checkElementIndex(index, registers.length);
    return registers[index];
  }

  /**
   * Sets register {@code index} to {@code max(register[index], rank)}.
   *
   * @return true if the register grew
   */
  boolean raise(int index, int rank)
  {
    Preconditions.checkElementIndex(index, registers.length);
    Preconditions.checkArgument(rank >= 0 && rank <= MAX_RANK, "invalid rank [%s]", rank);
    // note that both operands can never be negative, so we don't need to use unsigned comparison
    if (registers[index] < rank) {
      registers[index] = (byte) rank;
      return true;
    }
    return false;
  }

  /**
   * @return a new array holding, for every index, the larger register of {@code this} and {@code that}
   */
  RegisterArray pointwiseMax(RegisterArray that)
  {
    RegisterArray result = copy();
    result.raiseAll(that);
    return result;
  }

  /**
   * In-place form of {@link #pointwiseMax(RegisterArray)}. Either every register is updated or,
   * when the lengths differ, none is.
   */
  void raiseAll(RegisterArray that)
  {
    Preconditions.checkArgument(
        registers.length == that.registers.length,
        "register arrays differ in length: [%s] vs [%s]",
        registers.length,
        that.registers.length
    );
    for (int i = 0; i < registers.length; i++) {
      if (registers[i] < that.registers[i]) {
        registers[i] = that.registers[i];
      }
    }
  }

  int zeroCount()
  {
    int zeros = 0;
    for (byte register : registers) {
      if (register == 0) {
        zeros++;
      }
    }
    return zeros;
  }

  /**
   * @return the sum of {@code 2^-register[i]} over all registers
   */
  double harmonicSum()
  {
    double sum = 0.0;
    for (byte register : registers) {
      sum += 1.0 / (1L << register);
    }
    return sum;
  }

  RegisterArray copy()
  {
    return new RegisterArray(registers.clone());
  }

  static int packedLength(int size)
  {
    return (size * REGISTER_WIDTH + Byte.SIZE - 1) / Byte.SIZE;
  }

  /**
   * Writes the registers as consecutive 6-bit fields, most significant bit first, starting at
   * {@code dest[offset]}. The last byte is zero-padded.
   */
  void toPackedBytes(byte[] dest, int offset)
  {
    Preconditions.checkArgument(
        dest.length - offset >= packedLength(registers.length),
        "destination too small: need [%s] bytes from offset [%s], have [%s]",
        packedLength(registers.length),
        offset,
        dest.length
    );
    long buffer = 0;
    int bufferedBits = 0;
    int pos = offset;
    for (byte register : registers) {
      buffer = (buffer << REGISTER_WIDTH) | register;
      bufferedBits += REGISTER_WIDTH;
      while (bufferedBits >= Byte.SIZE) {
        bufferedBits -= Byte.SIZE;
        dest[pos++] = (byte) (buffer >>> bufferedBits);
      }
    }
    if (bufferedBits > 0) {
      dest[pos] = (byte) (buffer << (Byte.SIZE - bufferedBits));
    }
  }

  /**
   * Reads {@code size} registers written by {@link #toPackedBytes(byte[], int)}.
   *
   * @throws IllegalArgumentException if the source is too short or a register exceeds {@code maxRank}
   */
  static RegisterArray fromPackedBytes(byte[] src, int offset, int size, int maxRank)
  {
    Preconditions.checkArgument(
        src.length - offset == packedLength(size),
        "expected [%s] bytes of registers, got [%s]",
        packedLength(size),
        src.length - offset
    );
    byte[] registers = new byte[size];
    long buffer = 0;
    int bufferedBits = 0;
    int pos = offset;
    for (int i = 0; i < size; i++) {
      while (bufferedBits < REGISTER_WIDTH) {
        buffer = (buffer << Byte.SIZE) | (src[pos++] & 0xFF);
        bufferedBits += Byte.SIZE;
      }
      bufferedBits -= REGISTER_WIDTH;
      int rank = (int) ((buffer >>> bufferedBits) & MAX_RANK);
      Preconditions.checkArgument(rank <= maxRank, "register [%s] holds rank [%s] above [%s]", i, rank, maxRank);
      registers[i] = (byte) rank;
    }
    return new RegisterArray(registers);
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RegisterArray)) {
      return false;
    }
    return Arrays.equals(registers, ((RegisterArray) o).registers);
  }

  @Override
  public int hashCode()
  {
    return Arrays.hashCode(registers);
  }

  @Override
  public String toString()
  {
    return Arrays.toString(registers);
  }
}
