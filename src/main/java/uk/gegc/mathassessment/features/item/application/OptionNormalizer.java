package uk.gegc.mathassessment.features.item.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.mathassessment.shared.util.RandomSource;
import uk.gegc.mathassessment.shared.util.TextSanitizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns any list of candidate option strings into exactly {@value #OPTION_COUNT}
 * unique, non-empty options.
 * <p>
 * Candidates are trimmed and the first occurrence of each distinct non-empty value is
 * kept in input order. Missing slots are padded with small integers that do not collide
 * with the kept values.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OptionNormalizer {

    public static final int OPTION_COUNT = 5;

    private static final int FILLER_MIN = 1;
    private static final int FILLER_MAX = 99;

    private final RandomSource randomSource;
    private final TextSanitizer textSanitizer;

    public List<String> ensureFive(Collection<?> candidates) {
        Set<String> kept = new LinkedHashSet<>();
        if (candidates != null) {
            for (Object candidate : candidates) {
                String value = textSanitizer.sanitize(candidate);
                if (!value.isEmpty()) {
                    kept.add(value);
                }
                if (kept.size() == OPTION_COUNT) {
                    break;
                }
            }
        }

        int genuine = kept.size();
        while (kept.size() < OPTION_COUNT) {
            kept.add(String.valueOf(randomSource.nextInt(FILLER_MIN, FILLER_MAX)));
        }
        if (genuine < OPTION_COUNT) {
            log.debug("Padded options with {} filler value(s)", OPTION_COUNT - genuine);
        }
        return new ArrayList<>(kept);
    }
}
