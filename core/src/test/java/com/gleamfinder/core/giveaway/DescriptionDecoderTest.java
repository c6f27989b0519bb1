package com.gleamfinder.core.giveaway;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DescriptionDecoderTest {

    /** 백슬래시+u+hex 이스케이프 원문 */
    private static String esc(String hex) {
        return "\\" + "u" + hex;
    }

    @Nested
    @DisplayName("decodeHtml (ng-init 페이로드)")
    class Html {
        @Test
        void strips_tags_keeps_inner_text() {
            assertThat(DescriptionDecoder.decodeHtml("<p>Win a <b>Steam key</b></p><br>Good luck"))
                    .isEqualTo("Win a Steam keyGood luck");
        }

        @Test
        void nbsp_becomes_newline() {
            assertThat(DescriptionDecoder.decodeHtml("line1" + '\u00a0' + "line2")).isEqualTo("line1\nline2");
        }

        @Test
        void apostrophe_entity() {
            assertThat(DescriptionDecoder.decodeHtml("Don&#39;t miss")).isEqualTo("Don't miss");
        }

        @Test
        @DisplayName("닫히지 않은 '<' 는 그대로")
        void unclosed_tag_left_alone() {
            assertThat(DescriptionDecoder.decodeHtml("a < b")).isEqualTo("a < b");
            assertThat(DescriptionDecoder.decodeHtml("x <b>y</b> >")).isEqualTo("x y >");
        }

        @Test
        void other_entities_untouched() {
            assertThat(DescriptionDecoder.decodeHtml("Tom &amp; Jerry &#233;")).isEqualTo("Tom &amp; Jerry &#233;");
        }

        @Test
        void empty_or_null() {
            assertThat(DescriptionDecoder.decodeHtml("")).isEmpty();
            assertThat(DescriptionDecoder.decodeHtml(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("decodeScriptText (스크립트 원문 필드)")
    class Script {
        @Test
        void strips_escaped_tags() {
            String raw = "Win " + esc("003c") + "b" + esc("003e") + "big" + esc("003c") + "/b" + esc("003e") + " prizes";
            assertThat(DescriptionDecoder.decodeScriptText(raw)).isEqualTo("Win big prizes");
        }

        @Test
        void heading_markup_removed() {
            String raw = esc("003c") + "h2" + esc("003e") + "Win $1000" + esc("003c") + "/h2" + esc("003e");
            assertThat(DescriptionDecoder.decodeScriptText(raw)).isEqualTo("Win $1000");
            assertThat(DescriptionDecoder.decodeScriptText("It&#39;s fun")).isEqualTo("It's fun");
        }

        @Test
        void escaped_reference_outside_bmp() {
            String raw = "black heart " + esc("0026") + "#128420;";
            assertThat(DescriptionDecoder.decodeScriptText(raw))
                    .isEqualTo("black heart " + new String(Character.toChars(0x1F5A4)));
        }

        @Test
        @DisplayName("닫히지 않은 이스케이프 태그에서 자른다")
        void truncates_at_unclosed_escaped_tag() {
            String raw = "Prize pool " + esc("003c") + "a href=";
            assertThat(DescriptionDecoder.decodeScriptText(raw)).isEqualTo("Prize pool ");
        }

        @Test
        @DisplayName("4자리 hex가 없는 이스케이프에서 자른다")
        void truncates_at_partial_escape() {
            String raw = "Half an escape " + "\\" + "u00";
            assertThat(DescriptionDecoder.decodeScriptText(raw)).isEqualTo("Half an escape ");
        }

        @Test
        void apostrophe_and_numeric_references() {
            assertThat(DescriptionDecoder.decodeScriptText("It&#39;s caf&#233; time &#8364;5"))
                    .isEqualTo("It's café time €5");
        }

        @Test
        void escaped_numeric_reference() {
            String raw = "A " + esc("0026") + "#233; B";
            assertThat(DescriptionDecoder.decodeScriptText(raw)).isEqualTo("A é B");
        }

        @Test
        void supplementary_code_point() {
            assertThat(DescriptionDecoder.decodeScriptText("gift &#127873;"))
                    .isEqualTo("gift " + new String(Character.toChars(127873)));
        }

        @Test
        @DisplayName("잘못된 코드포인트에서 치환을 멈추고 나머지는 그대로")
        void stops_at_invalid_code_point() {
            assertThat(DescriptionDecoder.decodeScriptText("ok &#233; bad &#99999999; then &#233;"))
                    .isEqualTo("ok é bad &#99999999; then &#233;");
            assertThat(DescriptionDecoder.decodeScriptText("surrogate &#55357; &#233;"))
                    .isEqualTo("surrogate &#55357; &#233;");
        }

        @Test
        void missing_semicolon_left_as_is() {
            assertThat(DescriptionDecoder.decodeScriptText("x &#233 y")).isEqualTo("x &#233 y");
        }

        @Test
        void plain_text_unchanged() {
            assertThat(DescriptionDecoder.decodeScriptText("nothing to do")).isEqualTo("nothing to do");
            assertThat(DescriptionDecoder.decodeScriptText("")).isEmpty();
        }
    }
}
