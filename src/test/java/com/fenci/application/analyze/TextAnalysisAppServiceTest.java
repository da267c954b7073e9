package com.fenci.application.analyze;

import com.fenci.application.analyze.TextAnalysisAppService.TextAnalysis;
import com.fenci.application.segment.exception.TextTooLongException;
import com.fenci.domain.segment.model.ContentType;
import com.fenci.domain.segment.model.FeatureKind;
import com.fenci.domain.segment.model.TextFeature;
import com.fenci.infrastructure.ai.TextFeatureExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextAnalysisAppServiceTest {

    private TextAnalysisAppService service;

    @BeforeEach
    void setUp() throws Exception {
        service = new TextAnalysisAppService(new TextFeatureExtractor());
        Field field = TextAnalysisAppService.class.getDeclaredField("maxTextLength");
        field.setAccessible(true);
        field.set(service, 40);
    }

    @Test
    void analysis_combines_profile_and_features() {
        TextAnalysis analysis = service.analyze("write to ops@fenci.io");

        assertThat(analysis.profile().type()).isEqualTo(ContentType.CONTACT_INFO);
        assertThat(analysis.features()).extracting(TextFeature::kind).containsExactly(FeatureKind.EMAIL);
    }

    @Test
    void long_text_rejected() {
        assertThatThrownBy(() -> service.analyze("x".repeat(41)))
                .isInstanceOf(TextTooLongException.class);
        assertThatThrownBy(() -> service.repositoryLinks("a/".repeat(21)))
                .isInstanceOf(TextTooLongException.class);
    }

    @Test
    void repository_links_for_bare_pair() {
        assertThat(service.repositoryLinks("octo/cat")).isPresent();
    }
}
