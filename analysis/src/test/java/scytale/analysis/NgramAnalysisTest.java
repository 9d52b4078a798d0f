package scytale.analysis;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Test case for {@link NgramAnalysis}. */
class NgramAnalysisTest {

  @Test
  void testCharacterNgrams() {
    assertEquals(List.of("HE", "EL", "LL", "LO"), NgramAnalysis.ngrams("Hello", 2));
    assertEquals(List.of("A B", " B ", "B C"), NgramAnalysis.ngrams("a b c", 3));
    assertEquals(List.of("H", "I"), NgramAnalysis.ngrams("hi", 1, false));
  }

  @Test
  void testTextShorterThanN() {
    assertEquals(List.of(), NgramAnalysis.ngrams("ab", 3));
    assertEquals(List.of(), NgramAnalysis.ngrams("", 1));
    assertEquals(List.of(), NgramAnalysis.ngrams("one two", 3, true));
  }

  @Test
  void testWordNgrams() {
    assertEquals(
        List.of("the quick", "quick brown", "brown fox"),
        NgramAnalysis.ngrams("The quick, brown fox!", 2, true));
    // an apostrophe splits words
    assertEquals(List.of("it", "s", "not", "x_1"), NgramAnalysis.ngrams("It's NOT x_1", 1, true));
  }

  @ParameterizedTest
  @ValueSource(ints = {0, -1, Integer.MIN_VALUE})
  void testRejectsNonPositiveN(int n) {
    assertThrows(AnalysisDomainException.class, () -> NgramAnalysis.ngrams("text", n));
    assertThrows(AnalysisDomainException.class, () -> NgramAnalysis.ngrams("text", n, true));
    assertThrows(
        AnalysisDomainException.class, () -> NgramAnalysis.frequencyAnalysis("text", n, false));
  }

  @Test
  void testFrequencyAnalysis() {
    Map<String, Double> frequencies = NgramAnalysis.frequencyAnalysis("ABAA");
    assertEquals(List.of("A", "B"), List.copyOf(frequencies.keySet()));
    assertEquals(75.0, frequencies.get("A"), 1e-9);
    assertEquals(25.0, frequencies.get("B"), 1e-9);
  }

  @Test
  void testFrequencyTiesKeepFirstOccurrence() {
    Map<String, Double> frequencies = NgramAnalysis.frequencyAnalysis("CBAB C");
    assertEquals(List.of("C", "B", "A", " "), List.copyOf(frequencies.keySet()));
  }

  @Test
  void testFrequenciesSumToHundred() {
    Map<String, Double> frequencies =
        NgramAnalysis.frequencyAnalysis("THE QUICK BROWN FOX JUMPS OVER THE LAZY DOG", 2, false);
    double sum = frequencies.values().stream().mapToDouble(Double::doubleValue).sum();
    assertEquals(100.0, sum, 1e-9);
    assertEquals(List.of("TH", "HE", "E "), List.copyOf(frequencies.keySet()).subList(0, 3));
  }

  @Test
  void testWordFrequencies() {
    Map<String, Double> frequencies =
        NgramAnalysis.frequencyAnalysis("the cat and the hat", 1, true);
    assertEquals(40.0, frequencies.get("the"), 1e-9);
    assertEquals("the", frequencies.keySet().iterator().next());
  }

  @Test
  void testEmptyFrequencies() {
    assertTrue(NgramAnalysis.frequencyAnalysis("").isEmpty());
    assertTrue(NgramAnalysis.frequencyAnalysis("...", 1, true).isEmpty());
  }
}
