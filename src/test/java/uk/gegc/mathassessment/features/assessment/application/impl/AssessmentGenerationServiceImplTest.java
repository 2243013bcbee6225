package uk.gegc.mathassessment.features.assessment.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.DefaultResourceLoader;
import uk.gegc.mathassessment.features.ai.api.dto.GenerationOutcome;
import uk.gegc.mathassessment.features.ai.api.dto.GenerationOutcome.FailureReason;
import uk.gegc.mathassessment.features.ai.application.TextGenerator;
import uk.gegc.mathassessment.features.ai.application.impl.ItemResponseValidatorImpl;
import uk.gegc.mathassessment.features.ai.application.impl.PromptTemplateServiceImpl;
import uk.gegc.mathassessment.features.assessment.domain.model.TopicPool;
import uk.gegc.mathassessment.features.assessment.domain.model.TopicSlot;
import uk.gegc.mathassessment.features.curriculum.application.CurriculumMapper;
import uk.gegc.mathassessment.features.curriculum.domain.model.TopicCategory;
import uk.gegc.mathassessment.features.generator.application.DeterministicGeneratorFactory;
import uk.gegc.mathassessment.features.generator.application.impl.CircleAreaGenerator;
import uk.gegc.mathassessment.features.generator.application.impl.CoordinatePointGenerator;
import uk.gegc.mathassessment.features.generator.application.impl.LinearEquationGenerator;
import uk.gegc.mathassessment.features.generator.application.impl.PercentOfGroupGenerator;
import uk.gegc.mathassessment.features.generator.application.impl.QuadraticRootsGenerator;
import uk.gegc.mathassessment.features.item.application.AssessmentItemValidator;
import uk.gegc.mathassessment.features.item.application.OptionNormalizer;
import uk.gegc.mathassessment.features.item.domain.model.AssessmentItem;
import uk.gegc.mathassessment.shared.util.DefaultRandomSource;
import uk.gegc.mathassessment.shared.util.RandomSource;
import uk.gegc.mathassessment.shared.util.TextSanitizer;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AssessmentGenerationServiceImpl Tests")
class AssessmentGenerationServiceImplTest {

    @Mock
    private TextGenerator textGenerator;

    private RandomSource randomSource;
    private OptionNormalizer optionNormalizer;
    private DeterministicGeneratorFactory factory;
    private ItemResponseValidatorImpl responseValidator;
    private final AssessmentItemValidator itemValidator = new AssessmentItemValidator();

    @BeforeEach
    void setUp() {
        randomSource = DefaultRandomSource.seeded(2024L);
        TextSanitizer sanitizer = new TextSanitizer();
        optionNormalizer = new OptionNormalizer(randomSource, sanitizer);
        CurriculumMapper mapper = new CurriculumMapper();
        factory = new DeterministicGeneratorFactory(List.of(
                new CircleAreaGenerator(randomSource, optionNormalizer),
                new QuadraticRootsGenerator(randomSource, optionNormalizer),
                new CoordinatePointGenerator(randomSource, optionNormalizer),
                new PercentOfGroupGenerator(randomSource, optionNormalizer),
                new LinearEquationGenerator(randomSource, optionNormalizer)
        ), mapper);
        responseValidator = new ItemResponseValidatorImpl(sanitizer, optionNormalizer, mapper, factory);
        lenient().when(textGenerator.name()).thenReturn("mock");
    }

    private AssessmentGenerationServiceImpl service(Optional<TextGenerator> generator) {
        return new AssessmentGenerationServiceImpl(
                generator,
                new PromptTemplateServiceImpl(new DefaultResourceLoader()),
                responseValidator,
                factory,
                optionNormalizer,
                itemValidator,
                randomSource);
    }

    @Nested
    @DisplayName("generateAssessment without a text generator")
    class DeterministicOnly {

        @Test
        @DisplayName("returns the requested number of valid items")
        void generateAssessment_seven_sevenValidItems() {
            // When
            List<AssessmentItem> items = service(Optional.empty()).generateAssessment(7);

            // Then
            assertThat(items).hasSize(7);
            assertThat(items).allSatisfy(item -> assertThat(itemValidator.findViolations(item)).isEmpty());
        }

        @Test
        @DisplayName("zero items gives an empty assessment")
        void generateAssessment_zero_empty() {
            assertThat(service(Optional.empty()).generateAssessment(0)).isEmpty();
        }

        @Test
        @DisplayName("negative count throws IllegalArgumentException")
        void generateAssessment_negative_throws() {
            assertThatThrownBy(() -> service(Optional.empty()).generateAssessment(-1))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("negative");
        }

        @Test
        @DisplayName("same seed gives the same assessment")
        void generateAssessment_sameSeed_reproducible() {
            List<String> first = service(Optional.empty()).generateAssessment(3).stream()
                    .map(AssessmentItem::question).toList();
            setUp();
            List<String> second = service(Optional.empty()).generateAssessment(3).stream()
                    .map(AssessmentItem::question).toList();

            assertThat(second).isEqualTo(first);
        }
    }

    @Nested
    @DisplayName("sampleTopics")
    class SampleTopics {

        @Test
        @DisplayName("first five slots are distinct, the rest repeat pool entries")
        void sampleTopics_seven_firstFiveDistinct() {
            List<TopicSlot> slots = service(Optional.empty()).sampleTopics(7);

            assertThat(slots).hasSize(7);
            assertThat(slots.subList(0, 5)).containsExactlyInAnyOrderElementsOf(TopicPool.DEFAULT);
            assertThat(slots.subList(5, 7)).allMatch(TopicPool.DEFAULT::contains);
        }

        @Test
        @DisplayName("fewer than five slots are distinct")
        void sampleTopics_three_distinct() {
            assertThat(service(Optional.empty()).sampleTopics(3)).hasSize(3).doesNotHaveDuplicates();
        }
    }

    @Nested
    @DisplayName("generateItem with a text generator")
    class WithTextGenerator {

        @Test
        @DisplayName("usable response becomes the item")
        void generateItem_validResponse_used() {
            // Given
            when(textGenerator.generate(anyString())).thenReturn(GenerationOutcome.success(Map.of(
                    "question", "What is $\\frac{1}{2}$ of 10?",
                    "options", List.of("5", "2", "10", "20", "1"),
                    "correct_index", 0,
                    "explanation", "$10/2=5$")));

            // When
            AssessmentItem item = service(Optional.of(textGenerator)).generateItem("Fractions", "easy");

            // Then
            assertThat(item.question()).isEqualTo("What is $\\frac{1}{2}$ of 10?");
            assertThat(item.correctOption()).isEqualTo("5");
            assertThat(item.placement()).isEqualTo(TopicCategory.FRACTIONS_PERCENTS.placement());
        }

        @Test
        @DisplayName("prompt names the topic and difficulty")
        void generateItem_prompt_containsTopic() {
            when(textGenerator.generate(anyString()))
                    .thenReturn(GenerationOutcome.failure(FailureReason.BACKEND_UNAVAILABLE, "missing"));

            service(Optional.of(textGenerator)).generateItem("Circles", "moderate");

            verify(textGenerator).generate(argThat(
                    prompt -> prompt.contains("Circles") && prompt.contains("moderate")));
        }

        @Test
        @DisplayName("throwing generator falls back to a deterministic item")
        void generateItem_generatorThrows_fallback() {
            when(textGenerator.generate(anyString())).thenThrow(new IllegalStateException("boom"));

            AssessmentItem item = service(Optional.of(textGenerator)).generateItem("Circles", "moderate");

            assertThat(item.question()).startsWith("A circle has a radius of");
            assertThat(itemValidator.isValid(item)).isTrue();
        }

        @Test
        @DisplayName("every failure kind still yields a full assessment")
        void generateAssessment_failingBackend_fullAssessment() {
            when(textGenerator.generate(anyString()))
                    .thenReturn(GenerationOutcome.failure(FailureReason.MALFORMED_RESPONSE, "bad"));

            List<AssessmentItem> items = service(Optional.of(textGenerator)).generateAssessment(5);

            assertThat(items).hasSize(5).allMatch(itemValidator::isValid);
            verify(textGenerator, times(5)).generate(anyString());
        }
    }

    @Test
    @DisplayName("enforceInvariants: repairs option count and index")
    void enforceInvariants_brokenItem_repaired() {
        // Given
        AssessmentItem broken = AssessmentItem.placedIn(TopicCategory.CIRCLES.placement())
                .question("q")
                .options(List.of("a", "b"))
                .correctIndex(9)
                .explanation("e")
                .difficulty("easy")
                .build();

        // When
        AssessmentItem repaired = service(Optional.empty()).enforceInvariants(broken);

        // Then
        assertThat(repaired.options()).hasSize(5).startsWith("a", "b");
        assertThat(repaired.correctIndex()).isZero();
        assertThat(itemValidator.isValid(repaired)).isTrue();
    }

    @Test
    @DisplayName("enforceInvariants: valid item is returned untouched")
    void enforceInvariants_validItem_same() {
        AssessmentItem item = factory.generate("Circles", "easy");

        assertThat(service(Optional.empty()).enforceInvariants(item)).isSameAs(item);
    }
}
