package dev.feedlib.parse;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Hard validation pass over normalized feed and story records.
 *
 * <p>Violation messages are prefixed with the position of the offending record, e.g.
 * {@code storys[3].ident: size must be between 0 and 200}.
 */
@Component
public class FeedSchemaValidator {

  private final Validator validator;

  public FeedSchemaValidator(Validator validator) {
    this.validator = validator;
  }

  /**
   * Validates the feed and then every story, in order, stopping at the first invalid record.
   *
   * @param feed normalized feed record
   * @param stories normalized story records
   * @throws FeedParserException naming the first invalid record
   */
  public void validate(FeedRecord feed, List<StoryRecord> stories) {
    Set<ConstraintViolation<FeedRecord>> feedViolations = validator.validate(feed);
    if (!feedViolations.isEmpty()) {
      throw new FeedParserException(
          describe("feed", feedViolations), FeedParserException.FEED_LEVEL);
    }
    for (int i = 0; i < stories.size(); i++) {
      Set<ConstraintViolation<StoryRecord>> violations = validator.validate(stories.get(i));
      if (!violations.isEmpty()) {
        throw new FeedParserException(describe("storys[" + i + "]", violations), i);
      }
    }
  }

  private static <T> String describe(String prefix, Set<ConstraintViolation<T>> violations) {
    return violations.stream()
        .map(v -> prefix + "." + v.getPropertyPath() + ": " + v.getMessage())
        .sorted()
        .collect(Collectors.joining(", "));
  }
}
