package io.groupmatch.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.groupmatch.core.error.SpecConfigurationException;
import java.io.IOException;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class PredicateSpecTest {

    @Test
    void requiresAtLeastOneConstraint() {
        assertThatThrownBy(() -> ExpectedSpec.matcher().build())
                .isInstanceOf(SpecConfigurationException.class)
                .hasMessage("You must specify at least one parameter to match on.");
    }

    @Test
    void anySingleConstraintIsEnough() {
        assertThat(ExpectedSpec.matcher(IOException.class).build().exceptionType()).isEqualTo(IOException.class);
        assertThat(ExpectedSpec.matcher().match("disk").build().pattern().pattern()).isEqualTo("disk");
        assertThat(ExpectedSpec.matcher().check(e -> true).build().check()).isNotNull();
    }

    @Test
    void rejectsNonThrowableTypeResolvedAtRuntime() {
        @SuppressWarnings({"unchecked", "rawtypes"})
        Class<? extends Throwable> notThrowable = (Class) String.class;

        assertThatThrownBy(() -> new TypeSpec(notThrowable))
                .isInstanceOf(SpecConfigurationException.class)
                .hasMessageContaining("must be a subclass of Throwable");
    }

    @Test
    void patternsCompareBySourceAndFlags() {
        PredicateSpec a = ExpectedSpec.matcher().match(Pattern.compile("x+", Pattern.DOTALL)).build();
        PredicateSpec b = ExpectedSpec.matcher().match(Pattern.compile("x+", Pattern.DOTALL)).build();
        PredicateSpec c = ExpectedSpec.matcher().match("x+").build();

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b).isNotEqualTo(c);
    }

    @Test
    void checksCompareByIdentity() {
        NamedCheck check = NamedCheck.of("errno_is_5", e -> true);

        assertThat(ExpectedSpec.matcher().check(check).build())
                .isEqualTo(ExpectedSpec.matcher().check(check).build())
                .isNotEqualTo(ExpectedSpec.matcher().check(NamedCheck.of("errno_is_5", e -> true)).build());
    }

    @Test
    void typedCheckSeesNarrowedException() {
        PredicateSpec spec = ExpectedSpec.matcher(IllegalStateException.class)
                .check(e -> e.getMessage().startsWith("disk"))
                .build();

        assertThat(spec.check().test(new IllegalStateException("disk full"))).isTrue();
        assertThat(spec.check().test(new IllegalArgumentException("disk full"))).isFalse();
    }

    @Test
    void sameLambdaGivesEqualSpecs() {
        Predicate<IOException> check = e -> e.getMessage() != null;

        PredicateSpec first = ExpectedSpec.matcher(IOException.class).check(check).build();
        PredicateSpec second = ExpectedSpec.matcher(IOException.class).check(check).build();

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        assertThat(first.check()).hasToString(check.toString());
    }

    @Test
    void typedNamedCheckFailsOtherTypes() {
        NamedCheck errno = NamedCheck.of("errno_is_5", IOException.class, e -> "5".equals(e.getMessage()));

        assertThat(errno.test(new IOException("5"))).isTrue();
        assertThat(errno.test(new IllegalStateException("5"))).isFalse();
        assertThat(errno).hasToString("errno_is_5");
    }

    @Test
    void groupChecksFromTheSameLambdaCompareEqual() {
        Predicate<Throwable> check = e -> true;

        assertThat(ExpectedSpec.group().expect(IOException.class).check(check).build())
                .isEqualTo(ExpectedSpec.group().expect(IOException.class).check(check).build());
    }

    @Test
    void withPatternKeepsTypeAndCheck() {
        NamedCheck check = NamedCheck.of("c", e -> true);
        PredicateSpec spec = ExpectedSpec.matcher(IOException.class).match("a").check(check).build();
        PredicateSpec copy = spec.withPattern(Pattern.compile("b"));

        assertThat(copy.exceptionType()).isEqualTo(IOException.class);
        assertThat(copy.check()).isSameAs(check);
        assertThat(copy.pattern().pattern()).isEqualTo("b");
    }

    @Test
    void namedCheckRejectsBlankName() {
        assertThatThrownBy(() -> NamedCheck.of(" ", e -> true)).isInstanceOf(IllegalArgumentException.class);
        assertThat(NamedCheck.of("is_io", e -> true)).hasToString("is_io");
    }
}
