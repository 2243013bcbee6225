package uk.gegc.mathassessment.features.generator.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import uk.gegc.mathassessment.features.curriculum.application.CurriculumMapper;
import uk.gegc.mathassessment.features.curriculum.domain.model.TopicCategory;
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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DeterministicGeneratorFactory Tests")
class DeterministicGeneratorFactoryTest {

    private DeterministicGeneratorFactory factory;
    private RandomSource randomSource;
    private OptionNormalizer optionNormalizer;

    @BeforeEach
    void setUp() {
        randomSource = DefaultRandomSource.seeded(3L);
        optionNormalizer = new OptionNormalizer(randomSource, new TextSanitizer());
        factory = new DeterministicGeneratorFactory(List.of(
                new CircleAreaGenerator(randomSource, optionNormalizer),
                new QuadraticRootsGenerator(randomSource, optionNormalizer),
                new CoordinatePointGenerator(randomSource, optionNormalizer),
                new PercentOfGroupGenerator(randomSource, optionNormalizer),
                new LinearEquationGenerator(randomSource, optionNormalizer)
        ), new CurriculumMapper());
    }

    @ParameterizedTest
    @CsvSource({
            "CIRCLES, CircleAreaGenerator",
            "QUADRATICS, QuadraticRootsGenerator",
            "COORDINATE_GEOMETRY, CoordinatePointGenerator",
            "FRACTIONS_PERCENTS, PercentOfGroupGenerator",
            "INTERPRETING_VARIABLES, LinearEquationGenerator",
            "PROBLEM_SOLVING, LinearEquationGenerator"
    })
    @DisplayName("getGenerator: each category routes to its generator")
    void getGenerator_category_routed(TopicCategory category, String expectedClass) {
        assertThat(factory.getGenerator(category).getClass().getSimpleName()).isEqualTo(expectedClass);
    }

    @Test
    @DisplayName("generate: unknown topic gets a linear item placed as interpreting variables")
    void generate_unknownTopic_linearItem() {
        // When
        AssessmentItem item = factory.generate("Probability", "hard");

        // Then
        assertThat(item.question()).startsWith("If $").endsWith("what is the value of $x$?");
        assertThat(item.placement()).isEqualTo(TopicCategory.INTERPRETING_VARIABLES.placement());
        assertThat(item.difficulty()).isEqualTo("hard");
    }

    @Test
    @DisplayName("generate: coordinate topic gets points and the image flag")
    void generate_coordinateTopic_points() {
        AssessmentItem item = factory.generate("Coordinate Geometry", "easy");

        assertThat(item.hasImage()).isTrue();
        assertThat(item.pointsData()).hasSize(5);
    }

    @Test
    @DisplayName("generate: every default topic yields a valid item")
    void generate_allTopics_valid() {
        AssessmentItemValidator validator = new AssessmentItemValidator();
        for (String topic : List.of("Circles", "Quadratic Equations", "Coordinate Geometry",
                "Fractions, Decimals, & Percents", "Interpreting Variables", "Statistics")) {
            assertThat(validator.findViolations(factory.generate(topic, "moderate"))).as(topic).isEmpty();
        }
    }

    @Test
    @DisplayName("constructor: missing linear generator throws IllegalStateException")
    void constructor_noDefaultGenerator_throws() {
        List<DeterministicItemGenerator> generators = List.of(new CircleAreaGenerator(randomSource, optionNormalizer));

        assertThatThrownBy(() -> new DeterministicGeneratorFactory(generators, new CurriculumMapper()))
                .isInstanceOf(IllegalStateException.class);
    }
}
