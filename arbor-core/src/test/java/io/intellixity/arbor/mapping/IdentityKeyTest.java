package io.intellixity.arbor.mapping;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class IdentityKeyTest {
  @Test
  void integralNumbersCompareByValue() {
    assertEquals(IdentityKey.of(1), IdentityKey.of(1L));
    assertEquals(IdentityKey.of((short) 7, "a"), IdentityKey.of(7L, "a"));
    assertEquals(IdentityKey.of(BigInteger.TEN), IdentityKey.of(10));
    assertEquals(IdentityKey.of(new BigDecimal("3.00")), IdentityKey.of(3));
    assertEquals(IdentityKey.of(new BigDecimal("1.50")), IdentityKey.of(new BigDecimal("1.5")));
    assertEquals(IdentityKey.of(1).hashCode(), IdentityKey.of(1L).hashCode());
  }

  @Test
  void otherValuesUseEquals() {
    UUID id = UUID.randomUUID();
    assertEquals(IdentityKey.of(id), IdentityKey.of(UUID.fromString(id.toString())));
    assertNotEquals(IdentityKey.of("1"), IdentityKey.of(1));
  }

  @Test
  void nullChecks() {
    assertTrue(IdentityKey.of(null, null).allNull());
    assertFalse(IdentityKey.of(null, 1).allNull());
    assertTrue(IdentityKey.of(null, 1).anyNull());
    assertFalse(IdentityKey.of(2, 1).anyNull());
  }
}
