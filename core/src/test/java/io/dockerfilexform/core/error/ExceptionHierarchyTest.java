package io.dockerfilexform.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import org.junit.jupiter.api.Test;

/**
 * Tests for the exception hierarchy: abstract roots per phase and the fields each concrete type
 * carries.
 */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void dockerfileExceptionIsAbstractAndRoot() {
        assertThat(DockerfileException.class).isAbstract();
        assertThat(DockerfileException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void parseAndInterpretParentsAreAbstract() {
        assertThat(DockerfileParseException.class).isAbstract();
        assertThat(DockerfileParseException.class.getSuperclass()).isEqualTo(DockerfileException.class);
        assertThat(InterpretException.class).isAbstract();
        assertThat(InterpretException.class.getSuperclass()).isEqualTo(DockerfileException.class);
    }

    // --- Parse phase ---

    @Test
    void grammarParseExceptionCarriesLine() {
        var ex = new GrammarParseException("unterminated heredoc EOF", 7);

        assertThat(ex).isInstanceOf(DockerfileParseException.class);
        assertThat(ex.line()).isEqualTo(7);
        assertThat(ex.detail()).isEqualTo("line 7: unterminated heredoc EOF");
        assertThat(ex.phase()).isEqualTo(DockerfileException.Phase.PARSE);
    }

    @Test
    void lineZeroIsNotPrefixed() {
        var ex = new GrammarParseException("file with no instructions", 0);

        assertThat(ex.getMessage()).isEqualTo("file with no instructions");
    }

    @Test
    void directiveParseExceptionIsParsePhase() {
        var ex = new DirectiveParseException("only one escape parser directive can be used", 2);

        assertThat(ex).isInstanceOf(DockerfileParseException.class);
        assertThat(ex.phase()).isEqualTo(DockerfileException.Phase.PARSE);
    }

    // --- Interpret phase ---

    @Test
    void instructionParseExceptionCarriesKeyword() {
        var ex = new InstructionParseException("Unknown flag: bogus", "COPY");

        assertThat(ex).isInstanceOf(InterpretException.class);
        assertThat(ex.keyword()).isEqualTo("COPY");
        assertThat(ex.phase()).isEqualTo(DockerfileException.Phase.INTERPRET);
    }

    @Test
    void referenceFormatExceptionCarriesInput() {
        var ex = new ReferenceFormatException("invalid reference format", "Bad:Ref");

        assertThat(ex).isInstanceOf(InterpretException.class);
        assertThat(ex.input()).isEqualTo("Bad:Ref");
        assertThat(ex.getMessage()).isEqualTo("invalid reference format: Bad:Ref");
        assertThat(ex.keyword()).isNull();
    }

    @Test
    void wordExpansionExceptionIsInterpretPhase() {
        var ex = new WordExpansionException("BASE: required");

        assertThat(ex.phase()).isEqualTo(DockerfileException.Phase.INTERPRET);
        assertThat(ex.keyword()).isNull();
    }

    // --- Print phase ---

    @Test
    void printExceptionWrapsIoFailure() {
        var cause = new IOException("closed");
        var ex = new PrintException("Failed to write Dockerfile output", cause);

        assertThat(ex).isInstanceOf(DockerfileException.class);
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.phase()).isEqualTo(DockerfileException.Phase.PRINT);
    }
}
