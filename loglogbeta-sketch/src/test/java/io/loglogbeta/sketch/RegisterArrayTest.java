package io.loglogbeta.sketch;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class RegisterArrayTest
{
  @Test
  public void testNewArrayIsZeroed()
  {
    RegisterArray registers = new RegisterArray(16);
    assertEquals(16, registers.size());
    assertEquals(16, registers.zeroCount());
    assertEquals(16.0, registers.harmonicSum(), 0.0);
    for (int i = 0; i < 16; i++) {
      assertEquals(0, registers.get(i));
    }
  }

  @Test
  public void testRaiseNeverDecreases()
  {
    RegisterArray registers = new RegisterArray(16);
    assertTrue(registers.raise(3, 5));
    assertEquals(5, registers.get(3));

    assertFalse(registers.raise(3, 2));
    assertEquals(5, registers.get(3));

    assertFalse(registers.raise(3, 5));
    assertTrue(registers.raise(3, 7));
    assertEquals(7, registers.get(3));

    assertEquals(15, registers.zeroCount());
    assertEquals(15 + 1.0 / 128, registers.harmonicSum(), 1e-12);
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void testGetOutOfRange()
  {
    new RegisterArray(16).get(16);
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void testRaiseOutOfRange()
  {
    new RegisterArray(16).raise(-1, 1);
  }

  @Test
  public void testPointwiseMax()
  {
    RegisterArray a = new RegisterArray(4);
    a.raise(0, 3);
    a.raise(1, 1);
    RegisterArray b = new RegisterArray(4);
    b.raise(1, 4);
    b.raise(2, 2);

    RegisterArray max = a.pointwiseMax(b);
    assertEquals(3, max.get(0));
    assertEquals(4, max.get(1));
    assertEquals(2, max.get(2));
    assertEquals(0, max.get(3));
    assertEquals(max, b.pointwiseMax(a));

    // inputs are untouched
    assertEquals(1, a.get(1));
    assertEquals(0, a.get(2));
    assertEquals(0, b.get(0));
  }

  @Test
  public void testPointwiseMaxRejectsDifferentLengths()
  {
    RegisterArray a = new RegisterArray(16);
    a.raise(0, 1);
    RegisterArray b = new RegisterArray(32);
    b.raise(0, 9);
    try {
      a.pointwiseMax(b);
      fail("expected IllegalArgumentException");
    }
    catch (IllegalArgumentException e) {
      // expected
    }
    try {
      a.raiseAll(b);
      fail("expected IllegalArgumentException");
    }
    catch (IllegalArgumentException e) {
      // expected
    }
    assertEquals(1, a.get(0));
  }

  @Test
  public void testCopyIsIndependent()
  {
    RegisterArray a = new RegisterArray(16);
    a.raise(2, 2);
    RegisterArray copy = a.copy();
    assertEquals(a, copy);
    copy.raise(2, 9);
    assertEquals(2, a.get(2));
    assertNotEquals(a, copy);
  }

  @Test
  public void testPackedLayout()
  {
    RegisterArray registers = new RegisterArray(16);
    registers.raise(0, 1);
    registers.raise(1, 2);
    registers.raise(2, 3);
    registers.raise(3, 4);
    registers.raise(15, RegisterArray.MAX_RANK);

    assertEquals(12, RegisterArray.packedLength(16));
    byte[] packed = new byte[12];
    registers.toPackedBytes(packed, 0);
    // 000001 000010 000011 000100 ... 111111
    assertArrayEquals(
        new byte[]{0x04, 0x20, (byte) 0xC4, 0, 0, 0, 0, 0, 0, 0, 0, 0x3F},
        packed
    );

    assertEquals(registers, RegisterArray.fromPackedBytes(packed, 0, 16, RegisterArray.MAX_RANK));
  }

  @Test
  public void testPackedLengthPadsLastByte()
  {
    assertEquals(1, RegisterArray.packedLength(1));
    assertEquals(2, RegisterArray.packedLength(2));
    assertEquals(3, RegisterArray.packedLength(4));

    RegisterArray registers = new RegisterArray(1);
    registers.raise(0, 5);
    byte[] packed = new byte[1];
    registers.toPackedBytes(packed, 0);
    assertEquals((byte) 0x14, packed[0]);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnpackRejectsRankAboveMax()
  {
    byte[] packed = new byte[12];
    packed[11] = 0x3F;
    RegisterArray.fromPackedBytes(packed, 0, 16, 61);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnpackRejectsWrongLength()
  {
    RegisterArray.fromPackedBytes(new byte[11], 0, 16, 61);
  }
}
