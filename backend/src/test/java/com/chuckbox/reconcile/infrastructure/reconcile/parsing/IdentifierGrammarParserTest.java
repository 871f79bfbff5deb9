package com.chuckbox.reconcile.infrastructure.reconcile.parsing;

import com.chuckbox.reconcile.domain.requirement.model.IdFormat;
import com.chuckbox.reconcile.domain.requirement.model.ParsedId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class IdentifierGrammarParserTest {

    private IdentifierGrammarParser parser;

    @BeforeEach
    void setUp() {
        parser = new IdentifierGrammarParser();
    }

    @Nested
    @DisplayName("Grammar classification")
    class Classification {

        @ParameterizedTest
        @CsvSource({
                "'5 Option A(1)', OPTION_FORMAT",
                "'8 Option A (1)', OPTION_FORMAT",
                "'5. Opt A (1)', OPT_DOT_FORMAT",
                "'6 avian (1)', OTHER",
                "'6(2) hog', PAREN_OPTION",
                "'5f[1]b Opt A', OPT_FORMAT",
                "'2a Opt a', OPT_FORMAT",
                "'8A Opt 1', OPT_NUM_FORMAT",
                "'8A1 Opt 3', OPT_NUM_FORMAT",
                "'2a[1] Ice', BRACKET_OPTION",
                "'2d[1]', BRACKET_ONLY",
                "'3a(1)', PAREN_NESTED",
                "'2(a)(1)', PAREN_NESTED",
                "'6c2 hog', SPACE_OPTION",
                "'5a Grp 1', SPACE_OPTION",
                "'8a1', THREE_PART",
                "'2a', SIMPLE",
                "'2a.', SIMPLE",
                "'1', NUMBER_ONLY",
                "'1.', NUMBER_ONLY"
        })
        void classifies(String id, IdFormat expected) {
            assertThat(parser.parse(id).format()).isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("Field extraction")
    class Fields {

        @Test
        @DisplayName("bracket_only: main, letter and bracketed sub-number")
        void bracket_only() {
            ParsedId parsed = parser.parse("2d[1]");

            assertThat(parsed.mainNumber()).isEqualTo("2");
            assertThat(parsed.letter()).isEqualTo("d");
            assertThat(parsed.subNumber()).isEqualTo("1");
            assertThat(parsed.subLetter()).isNull();
            assertThat(parsed.option()).isNull();
        }

        @Test
        @DisplayName("three_part: main, letter and trailing sub-number")
        void three_part() {
            ParsedId parsed = parser.parse("8a1");

            assertThat(parsed.mainNumber()).isEqualTo("8");
            assertThat(parsed.letter()).isEqualTo("a");
            assertThat(parsed.subNumber()).isEqualTo("1");
            assertThat(parsed.subLetter()).isNull();
            assertThat(parsed.option()).isNull();
        }

        @Test
        @DisplayName("option_format without a space before the parenthesis")
        void option_format_compact() {
            ParsedId parsed = parser.parse("5 Option A(1)");

            assertThat(parsed.format()).isEqualTo(IdFormat.OPTION_FORMAT);
            assertThat(parsed.mainNumber()).isEqualTo("5");
            assertThat(parsed.letter()).isNull();
            assertThat(parsed.subNumber()).isEqualTo("1");
            assertThat(parsed.subLetter()).isNull();
            assertThat(parsed.option()).isEqualTo("option a");
        }

        @Test
        @DisplayName("option_format with trailing sub-letter")
        void option_format() {
            ParsedId parsed = parser.parse("5 Option A (1)(a)");

            assertThat(parsed.mainNumber()).isEqualTo("5");
            assertThat(parsed.letter()).isNull();
            assertThat(parsed.subNumber()).isEqualTo("1");
            assertThat(parsed.subLetter()).isEqualTo("a");
            assertThat(parsed.option()).isEqualTo("option a");
        }

        @Test
        @DisplayName("bracket_option lowercases the option word")
        void bracket_option() {
            ParsedId parsed = parser.parse("2a[1] Ice");

            assertThat(parsed.mainNumber()).isEqualTo("2");
            assertThat(parsed.letter()).isEqualTo("a");
            assertThat(parsed.subNumber()).isEqualTo("1");
            assertThat(parsed.option()).isEqualTo("ice");
        }

        @Test
        @DisplayName("space_option keeps the whole remainder as option")
        void space_option() {
            ParsedId parsed = parser.parse("5a Grp 1");

            assertThat(parsed.letter()).isEqualTo("a");
            assertThat(parsed.subNumber()).isNull();
            assertThat(parsed.option()).isEqualTo("grp 1");

            ParsedId withSub = parser.parse("6c2 hog");
            assertThat(withSub.subNumber()).isEqualTo("2");
            assertThat(withSub.option()).isEqualTo("hog");
        }

        @Test
        @DisplayName("paren_nested: digits or roman numerals are a sub-number")
        void paren_nested_sub_number() {
            ParsedId digits = parser.parse("3a(1)");
            assertThat(digits.letter()).isEqualTo("a");
            assertThat(digits.subNumber()).isEqualTo("1");

            ParsedId roman = parser.parse("6b(ii)");
            assertThat(roman.letter()).isEqualTo("b");
            assertThat(roman.subNumber()).isEqualTo("ii");
        }

        @Test
        @DisplayName("paren_nested: a parenthesized letter is the letter")
        void paren_nested_letter() {
            ParsedId parsed = parser.parse("2(a)(1)");

            assertThat(parsed.mainNumber()).isEqualTo("2");
            assertThat(parsed.letter()).isEqualTo("a");
            assertThat(parsed.subNumber()).isEqualTo("1");
        }

        @Test
        @DisplayName("opt_num_format keeps the numeric option")
        void opt_num_format() {
            ParsedId parsed = parser.parse("8A1 Opt 3");

            assertThat(parsed.letter()).isEqualTo("a");
            assertThat(parsed.subNumber()).isEqualTo("1");
            assertThat(parsed.option()).isEqualTo("opt 3");
        }

        @Test
        @DisplayName("raw id is preserved as given")
        void keeps_raw() {
            assertThat(parser.parse(" 2a ").raw()).isEqualTo(" 2a ");
            assertThat(parser.parse(" 2a ").format()).isEqualTo(IdFormat.SIMPLE);
        }
    }

    @Nested
    @DisplayName("Totality")
    class Totality {

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "abc", "Option A", "a1", "#", "(1)"})
        void unknown_never_throws(String id) {
            ParsedId parsed = parser.parse(id);

            assertThat(parsed.format()).isEqualTo(IdFormat.UNKNOWN);
            assertThat(parsed.mainNumber()).isNull();
            assertThat(parsed.letter()).isNull();
            assertThat(parsed.subNumber()).isNull();
            assertThat(parsed.subLetter()).isNull();
            assertThat(parsed.option()).isNull();
        }
    }
}
