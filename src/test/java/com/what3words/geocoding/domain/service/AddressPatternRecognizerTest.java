package com.what3words.geocoding.domain.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AddressPatternRecognizerTest {

    private final AddressPatternRecognizer recognizer = new AddressPatternRecognizer();

    @Test
    void testIsPossibleAddress_CanonicalAddress_ReturnsTrue() {
        assertThat(recognizer.isPossibleAddress("filled.count.soap")).isTrue();
        assertThat(recognizer.isPossibleAddress("Filled.COUNT.soap")).isTrue();
        assertThat(recognizer.isPossibleAddress("  filled.count.soap\n")).isTrue();
    }

    @Test
    void testIsPossibleAddress_NonLatinScripts_ReturnsTrue() {
        assertThat(recognizer.isPossibleAddress("école.façade.garçon")).isTrue();
        assertThat(recognizer.isPossibleAddress("дом.кот.сад")).isTrue();
        assertThat(recognizer.isPossibleAddress("αλφα.βήτα.γάμμα")).isTrue();
        assertThat(recognizer.isPossibleAddress("中文.地址.测试")).isTrue();
        assertThat(recognizer.isPossibleAddress("नमस्ते.दुनिया.भारत")).isTrue();
    }

    @Test
    void testIsPossibleAddress_SpacesOrMixedDelimiters_ReturnsFalse() {
        assertThat(recognizer.isPossibleAddress("not a 3wa")).isFalse();
        assertThat(recognizer.isPossibleAddress("not.a 3wa")).isFalse();
        assertThat(recognizer.isPossibleAddress("filled.count soap")).isFalse();
        assertThat(recognizer.isPossibleAddress("filled-count.soap")).isFalse();
    }

    @Test
    void testIsPossibleAddress_WrongArity_ReturnsFalse() {
        assertThat(recognizer.isPossibleAddress("filled.count")).isFalse();
        assertThat(recognizer.isPossibleAddress("filled.count.soap.today")).isFalse();
        assertThat(recognizer.isPossibleAddress("filled..count.soap")).isFalse();
        assertThat(recognizer.isPossibleAddress(".filled.count.soap")).isFalse();
        assertThat(recognizer.isPossibleAddress("filled.count.soap.")).isFalse();
    }

    @Test
    void testIsPossibleAddress_DigitsAndSymbols_ReturnsFalse() {
        assertThat(recognizer.isPossibleAddress("1.2.3")).isFalse();
        assertThat(recognizer.isPossibleAddress("invalid.3wa.address")).isFalse();
        assertThat(recognizer.isPossibleAddress("filled.count.so@p")).isFalse();
        assertThat(recognizer.isPossibleAddress("filled.count.soap!")).isFalse();
    }

    @Test
    void testIsPossibleAddress_EmptyOrNull_ReturnsFalse() {
        assertThat(recognizer.isPossibleAddress("")).isFalse();
        assertThat(recognizer.isPossibleAddress("   ")).isFalse();
        assertThat(recognizer.isPossibleAddress(null)).isFalse();
    }

    @Test
    void testFindPossibleAddresses_SingleAddress_ReturnsIt() {
        assertThat(recognizer.findPossibleAddresses("Please leave by my porch at filled.count.soap"))
            .containsExactly("filled.count.soap");
    }

    @Test
    void testFindPossibleAddresses_TwoAddresses_ReturnsBothInOrder() {
        assertThat(recognizer.findPossibleAddresses(
            "Please leave by my porch at filled.count.soap or deed.tulip.judge"))
            .containsExactly("filled.count.soap", "deed.tulip.judge");
    }

    @Test
    void testFindPossibleAddresses_NoAddress_ReturnsEmpty() {
        assertThat(recognizer.findPossibleAddresses("Please leave by my porch")).isEmpty();
        assertThat(recognizer.findPossibleAddresses("")).isEmpty();
        assertThat(recognizer.findPossibleAddresses(null)).isEmpty();
    }

    @Test
    void testFindPossibleAddresses_SurroundingPunctuation_IsExcluded() {
        assertThat(recognizer.findPossibleAddresses("This is a test with filled.count.soap."))
            .containsExactly("filled.count.soap");
        assertThat(recognizer.findPossibleAddresses("(filled.count.soap), \"index.home.raft\"!"))
            .containsExactly("filled.count.soap", "index.home.raft");
        assertThat(recognizer.findPossibleAddresses("see ///filled.count.soap..."))
            .containsExactly("filled.count.soap");
        assertThat(recognizer.findPossibleAddresses("https://w3w.co/filled.count.soap"))
            .containsExactly("filled.count.soap");
    }

    @Test
    void testFindPossibleAddresses_PreservesOriginalCasing() {
        assertThat(recognizer.findPossibleAddresses("Meet at FILLED.Count.soap tonight"))
            .containsExactly("FILLED.Count.soap");
    }

    @Test
    void testFindPossibleAddresses_WrongArityOrDigits_YieldsNoPartialMatch() {
        assertThat(recognizer.findPossibleAddresses("1.2.3 and a.b and one.two.three.four"))
            .isEmpty();
        assertThat(recognizer.findPossibleAddresses("filled.count.soap123 or v2.count.soap"))
            .isEmpty();
    }

    @Test
    void testFindPossibleAddresses_MixedScripts_AreFound() {
        assertThat(recognizer.findPossibleAddresses("Москва: дом.кот.сад, Paris: école.façade.garçon"))
            .containsExactly("дом.кот.сад", "école.façade.garçon");
    }

    @Test
    void testFindPossibleAddresses_EveryMatchIsPossibleAddress() {
        List<String> texts = List.of(
            "from index.home.raft to filled.count.soap",
            "a.b.c.d e.f.g ...h.i.j... k.l",
            "(αλφα.βήτα.γάμμα); 中文.地址.测试。",
            "trailing dots a.b.c.. and leading ..d.e.f");
        for (String text : texts) {
            assertThat(recognizer.findPossibleAddresses(text))
                .isNotEmpty()
                .allSatisfy(match -> assertThat(recognizer.isPossibleAddress(match)).isTrue());
        }
    }

    @Test
    void testFindPossibleAddresses_RepeatedCalls_ReturnSameSequence() {
        String text = "Please leave by my porch at filled.count.soap or deed.tulip.judge";

        List<String> first = recognizer.findPossibleAddresses(text);
        List<String> second = recognizer.findPossibleAddresses(text);

        assertThat(second).isEqualTo(first);
        assertThat(recognizer.isPossibleAddress("filled.count.soap"))
            .isEqualTo(recognizer.isPossibleAddress("filled.count.soap"));
    }

    @Test
    void testDidYouMean_UniformSeparator_ReturnsTrue() {
        assertThat(recognizer.didYouMean("filled count soap")).isTrue();
        assertThat(recognizer.didYouMean("filled-count-soap")).isTrue();
        assertThat(recognizer.didYouMean("filled.count.soap")).isTrue();
        assertThat(recognizer.didYouMean("filled｡count｡soap")).isTrue();
        assertThat(recognizer.didYouMean("filled。count。soap")).isTrue();
    }

    @Test
    void testDidYouMean_NoSeparator_ReturnsFalse() {
        assertThat(recognizer.didYouMean("filledcountsoap")).isFalse();
    }

    @Test
    void testDidYouMean_MixedSeparators_ReturnsFalse() {
        assertThat(recognizer.didYouMean("filled count-soap")).isFalse();
        assertThat(recognizer.didYouMean("filled.count soap")).isFalse();
    }

    @Test
    void testDidYouMean_WrongShape_ReturnsFalse() {
        assertThat(recognizer.didYouMean("filled count")).isFalse();
        assertThat(recognizer.didYouMean("please leave it by the door")).isFalse();
        assertThat(recognizer.didYouMean("filled count 42")).isFalse();
        assertThat(recognizer.didYouMean(null)).isFalse();
    }
}
