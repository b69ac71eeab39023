package dev.mirror.controller.explain;

import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ResilientExplanationServiceTest {

    private final ExplanationService delegate = mock(ExplanationService.class);
    private final ExplanationService service = new ResilientExplanationService(delegate);

    @Test
    void answerIsPassedThrough() {
        when(delegate.explain("int x;", "A.java")).thenReturn("Declares x.");

        assertThat(service.explain("int x;", "A.java")).isEqualTo("Declares x.");
    }

    @Test
    void failureBecomesFixedSentence() {
        when(delegate.explain(anyString(), anyString())).thenThrow(new IllegalStateException("quota exceeded"));
        when(delegate.summarize(any())).thenThrow(new IllegalStateException("quota exceeded"));

        assertThat(service.explain("int x;", "A.java")).isEqualTo(ResilientExplanationService.NO_EXPLANATION);
        assertThat(service.summarize(List.of("A.java"))).isEqualTo(ResilientExplanationService.NO_SUMMARY);
    }

    @Test
    void blankAnswerBecomesFixedSentence() {
        when(delegate.explain(anyString(), anyString())).thenReturn("  ");
        when(delegate.summarize(any())).thenReturn(null);

        assertThat(service.explain("int x;", "A.java")).isEqualTo(ResilientExplanationService.NO_EXPLANATION);
        assertThat(service.summarize(List.of("A.java", "B.java"))).isEqualTo(ResilientExplanationService.NO_SUMMARY);
    }
}
