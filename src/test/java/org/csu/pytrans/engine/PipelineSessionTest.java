package org.csu.pytrans.engine;

import org.csu.pytrans.common.exception.PipelineStateException;
import org.csu.pytrans.common.exception.SourceLoadException;
import org.csu.pytrans.compiler.semantic.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * 会话的前置条件检查。使用 Mock 的 SourceLoader 隔离文件系统。
 */
public class PipelineSessionTest {

    private static final Path SOURCE = Path.of("hello.py");
    private static final Path OTHER = Path.of("other.py");

    private SourceLoader mockLoader;
    private TranslationProcessor processor;
    private PipelineSession session;

    @BeforeEach
    void setUp() {
        mockLoader = Mockito.mock(SourceLoader.class);
        processor = Mockito.spy(new TranslationProcessor());
        session = new PipelineSession(processor, mockLoader);

        when(mockLoader.loadSource(SOURCE)).thenReturn("def main():print\"Hello\"");
        when(mockLoader.loadSource(OTHER)).thenReturn("print oops");
    }

    @Test
    void testStagesBeforeLoadAreRejected() {
        PipelineStateException e = assertThrows(PipelineStateException.class, () -> session.tokenize());
        assertEquals("Load a file first.", e.getMessage());

        assertEquals("Tokenize the code first.",
                assertThrows(PipelineStateException.class, () -> session.parse()).getMessage());
        assertEquals("Parse the code first.",
                assertThrows(PipelineStateException.class, () -> session.checkSemantics()).getMessage());
        assertEquals("Parse the code first.",
                assertThrows(PipelineStateException.class, () -> session.generate()).getMessage());
        assertEquals("Generate code first.",
                assertThrows(PipelineStateException.class, () -> session.save(Path.of("out.cpp"))).getMessage());

        // 阶段本身从未被调用
        verifyNoInteractions(processor);
        verify(mockLoader, never()).writeOutput(any(), anyString());
    }

    @Test
    void testFullSequence() {
        session.load(SOURCE);
        assertEquals(6, session.tokenize().size());
        assertEquals(2, session.parse().getChildren().size());

        ValidationResult validation = session.checkSemantics();
        assertTrue(validation.passed());
        assertSame(validation, session.getLastValidation());

        String code = session.generate();
        assertEquals("void  () {\noutput << \"Hello\" << newline;\n}\n", code);

        Path target = Path.of("build", "hello.cpp");
        session.save(target);
        verify(mockLoader).writeOutput(target, code);
    }

    @Test
    void testGenerateDoesNotRequireValidation() {
        session.load(OTHER);
        session.tokenize();
        session.parse();

        assertEquals("output <<  oops << newline;\n}\n", session.generate());
        verify(processor, never()).validate(any());
    }

    @Test
    void testValidationFailureIsRecoverable() {
        session.load(OTHER);
        session.tokenize();
        session.parse();

        assertFalse(session.checkSemantics().passed());
        assertNotNull(session.generate());
    }

    @Test
    void testLoadingNewFileResetsDerivedState() {
        session.load(SOURCE);
        session.tokenize();
        session.parse();
        session.generate();

        session.load(OTHER);

        assertEquals(OTHER, session.getSourcePath());
        assertNull(session.getTokens());
        assertNull(session.getTree());
        assertNull(session.getGeneratedCode());
        assertThrows(PipelineStateException.class, () -> session.parse());
    }

    @Test
    void testRetokenizingDiscardsTree() {
        session.load(SOURCE);
        session.tokenize();
        session.parse();

        session.tokenize();

        assertNull(session.getTree());
        assertThrows(PipelineStateException.class, () -> session.generate());
    }

    @Test
    void testFailedLoadKeepsPreviousSource() {
        Path missing = Path.of("missing.py");
        when(mockLoader.loadSource(missing)).thenThrow(new SourceLoadException(missing, "File not found: missing.py"));

        session.load(SOURCE);
        session.tokenize();
        assertThrows(SourceLoadException.class, () -> session.load(missing));

        assertEquals(SOURCE, session.getSourcePath());
        assertNotNull(session.getTokens());
    }

    @Test
    void testEmptySourceCannotBeParsed() {
        Path empty = Path.of("empty.py");
        when(mockLoader.loadSource(empty)).thenReturn("");

        session.load(empty);
        assertTrue(session.tokenize().isEmpty());
        assertEquals("Tokenize the code first.",
                assertThrows(PipelineStateException.class, () -> session.parse()).getMessage());
    }
}
