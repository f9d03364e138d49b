package me.golemcore.proxy.domain.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ThinkingTextProcessorTest {

    private final ThinkingTextProcessor processor = new ThinkingTextProcessor();

    @Test
    void shouldExtractResponseAndDropThinking() {
        String text = "<think>plan the scene</think>\n<response>She smiles.</response>";

        assertEquals("She smiles.", processor.process(text, false));
    }

    @Test
    void shouldKeepThinkingWhenRequested() {
        String text = "<think>plan</think><response>Reply</response>";

        assertEquals("<think>\nplan\n</think>\nReply", processor.process(text, true));
    }

    @Test
    void shouldHandleMissingThinkOpenTag() {
        // the opener is sent as a prefill, so the model usually starts mid-block
        String text = "still thinking</think><response>Reply</response>";

        assertEquals("Reply", processor.process(text, false));
        assertEquals("<think>\nstill thinking\n</think>\nReply", processor.process(text, true));
    }

    @Test
    void shouldTolerateUnclosedResponse() {
        assertEquals("Reply continues", processor.process("<think>x</think><response>Reply continues", false));
    }

    @Test
    void shouldLeaveUntaggedTextAlone() {
        assertEquals("Plain reply", processor.process("Plain reply", false));
        assertEquals("Plain reply", processor.process("Plain reply", true));
    }

    @Test
    void shouldLeaveUnclosedThinkingInPlace() {
        assertEquals("<think>never closed", processor.process("<think>never closed", false));
    }
}
