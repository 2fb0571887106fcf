package io.dockerfilexform.core.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.dockerfilexform.core.error.DirectiveParseException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DirectiveParser")
class DirectiveParserTest {

    @Test
    @DisplayName("reads the leading directive block in order")
    void leadingBlock() {
        List<Directive> directives = DirectiveParser.parseAll("# syntax=docker/dockerfile:1\n#escape = `\nFROM alpine\n");

        assertThat(directives)
                .containsExactly(
                        new Directive("syntax", "docker/dockerfile:1", 1),
                        new Directive("escape", "`", 2));
        assertThat(DirectiveParser.escapeToken(directives)).isEqualTo('`');
    }

    @Test
    @DisplayName("the block ends at the first ordinary comment, blank line or instruction")
    void stopsAtFirstNonDirective() {
        assertThat(DirectiveParser.parseAll("# hello\n# escape=`\nFROM alpine\n")).isEmpty();
        assertThat(DirectiveParser.parseAll("# syntax=x\n\n# escape=`\n")).hasSize(1);
        assertThat(DirectiveParser.parseAll("FROM alpine\n# escape=`\n")).isEmpty();
    }

    @Test
    @DisplayName("unknown names end the block rather than failing")
    void unknownName() {
        assertThat(DirectiveParser.parseAll("# foo=bar\n# escape=`\nFROM alpine\n")).isEmpty();
    }

    @Test
    @DisplayName("the default escape token is a backslash")
    void defaultEscape() {
        assertThat(DirectiveParser.escapeToken(List.of())).isEqualTo('\\');
    }

    @Test
    @DisplayName("a repeated directive is rejected with its line")
    void duplicate() {
        assertThatThrownBy(() -> DirectiveParser.parseAll("# escape=`\n# escape=\\\nFROM alpine\n"))
                .isInstanceOf(DirectiveParseException.class)
                .hasMessage("line 2: only one escape parser directive can be used");
    }

    @Test
    @DisplayName("an escape value other than backslash or backtick is rejected")
    void badEscape() {
        assertThatThrownBy(() -> DirectiveParser.parseAll("# escape=x\nFROM alpine\n"))
                .isInstanceOf(DirectiveParseException.class)
                .hasMessageContaining("invalid escape token 'x'");
    }
}
