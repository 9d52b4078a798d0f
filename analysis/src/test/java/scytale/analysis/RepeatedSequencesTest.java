package scytale.analysis;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Test case for {@link RepeatedSequences}. */
class RepeatedSequencesTest {

  @Test
  void testFindsRepeatsWithAscendingOffsets() {
    assertEquals(Map.of("ABC", List.of(0, 4, 8)), RepeatedSequences.find("ABCXABCYABC", 3, 4));
  }

  @Test
  void testDefaults() {
    assertEquals(
        RepeatedSequences.find("ABCXABCYABC", 3, 10), RepeatedSequences.find("ABCXABCYABC"));
  }

  @Test
  void testIgnoresCase() {
    assertEquals(Map.of("ABC", List.of(0, 3)), RepeatedSequences.find("abcABC", 3, 3));
  }

  @Test
  void testSkipsWindowsWithNonLetters() {
    assertEquals(Map.of("AB", List.of(0, 3)), RepeatedSequences.find("AB AB", 2, 2));
    assertTrue(RepeatedSequences.find("12312312", 3, 3).isEmpty());
  }

  @Test
  void testOverlappingOccurrences() {
    Map<String, List<Integer>> repeats = RepeatedSequences.find("AAAA", 2, 3);
    assertEquals(List.of("AA", "AAA"), List.copyOf(repeats.keySet()));
    assertEquals(List.of(0, 1, 2), repeats.get("AA"));
    assertEquals(List.of(0, 1), repeats.get("AAA"));
  }

  @Test
  void testNoRepeats() {
    assertTrue(RepeatedSequences.find("ABCDEFG").isEmpty());
    assertTrue(RepeatedSequences.find("").isEmpty());
  }

  @Test
  void testSpacings() {
    Map<String, List<Integer>> spacings = RepeatedSequences.spacings("ABCXABCYYABC", 3, 3);
    assertEquals(Map.of("ABC", List.of(4, 5)), spacings);
  }

  @Test
  void testKasiskiSpacingsAreMultiplesOfKeyLength() {
    // "THE" under the key LEMON at offsets 0 and 20 encrypts to ELQ both times
    String ciphertext = "ELQ" + "X".repeat(17) + "ELQ";
    assertEquals(List.of(20), RepeatedSequences.spacings(ciphertext, 3, 3).get("ELQ"));
  }

  @Test
  void testRejectsInvalidBounds() {
    assertThrows(AnalysisDomainException.class, () -> RepeatedSequences.find("ABC", 0, 3));
    assertThrows(AnalysisDomainException.class, () -> RepeatedSequences.find("ABC", 4, 3));
    assertThrows(AnalysisDomainException.class, () -> RepeatedSequences.spacings("ABC", -1, 2));
  }
}
