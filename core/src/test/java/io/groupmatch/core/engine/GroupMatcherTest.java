package io.groupmatch.core.engine;

import static io.groupmatch.core.model.ExpectedSpec.group;
import static io.groupmatch.core.model.ExpectedSpec.groupOf;
import static io.groupmatch.core.model.ExpectedSpec.type;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.groupmatch.core.model.BaseExceptionGroup;
import io.groupmatch.core.model.ExceptionGroup;
import io.groupmatch.core.model.ExpectedSpec;
import io.groupmatch.core.model.GroupSpec;
import io.groupmatch.core.model.MatchOutcome;
import io.groupmatch.core.model.NamedCheck;
import io.groupmatch.core.model.RaisedException;
import io.groupmatch.core.model.ThrowableGroup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("GroupMatcher")
class GroupMatcherTest {

    private final GroupMatcher matcher = GroupMatcher.create();

    @Nested
    @DisplayName("basic shapes")
    class Shapes {

        @Test
        @DisplayName("single expected type inside a group")
        void singleChild() {
            MatchOutcome outcome =
                    matcher.match(groupOf(IllegalStateException.class), new ExceptionGroup("", new IllegalStateException("x")));

            assertThat(outcome.success()).isTrue();
            assertThat(outcome.diagnostic()).isNull();
        }

        @Test
        @DisplayName("wrong child type reports the type mismatch verbatim")
        void wrongChildType() {
            MatchOutcome outcome = matcher.match(
                    groupOf(IllegalStateException.class), new ExceptionGroup("", new IllegalArgumentException("x")));

            assertThat(outcome.success()).isFalse();
            assertThat(outcome.diagnostic())
                    .isEqualTo("'IllegalArgumentException' is not of type 'IllegalStateException'");
        }

        @Test
        @DisplayName("subclasses satisfy a type spec")
        void subclass() {
            assertThat(matcher.matches(
                            groupOf(IllegalArgumentException.class),
                            new ExceptionGroup("", new NumberFormatException("NaN"))))
                    .isTrue();
        }

        @Test
        @DisplayName("children match in any order")
        void anyOrder() {
            var raised = new ExceptionGroup("", new IllegalArgumentException(), new IllegalStateException());

            assertThat(matcher.matches(groupOf(IllegalStateException.class, IllegalArgumentException.class), raised))
                    .isTrue();
            assertThat(matcher.matches(groupOf(IllegalArgumentException.class, IllegalStateException.class), raised))
                    .isTrue();
        }

        @Test
        @DisplayName("nested groups must be mirrored by nested specs")
        void nestedStructure() {
            var raised = new ExceptionGroup(
                    "outer", new IllegalStateException(), new ExceptionGroup("inner", new IllegalArgumentException()));

            assertThat(matcher.matches(
                            group(type(IllegalStateException.class), groupOf(IllegalArgumentException.class)), raised))
                    .isTrue();
            assertThat(matcher.matches(groupOf(IllegalStateException.class, IllegalArgumentException.class), raised))
                    .isFalse();
        }

        @Test
        @DisplayName("lone exception against a non-group spec")
        void loneException() {
            assertThat(matcher.matches(type(IllegalStateException.class), new IllegalStateException())).isTrue();
            assertThat(matcher.match(type(IllegalStateException.class), new IllegalArgumentException())
                            .diagnostic())
                    .isEqualTo("'IllegalArgumentException' is not of type 'IllegalStateException'");
        }

        @Test
        @DisplayName("a group spec never matches a lone exception by default")
        void notAGroup() {
            assertThat(matcher.match(groupOf(IllegalStateException.class, IllegalArgumentException.class),
                                    new IllegalStateException())
                            .diagnostic())
                    .isEqualTo("'IllegalStateException' is not an exception group");
        }

        @Test
        @DisplayName("null exception never matches")
        void nullException() {
            MatchOutcome outcome = matcher.match(groupOf(IllegalStateException.class), (Throwable) null);

            assertThat(outcome.success()).isFalse();
            assertThat(outcome.diagnostic()).isEqualTo("exception is null");
        }

        @Test
        @DisplayName("a pre-built snapshot can be matched directly")
        void snapshot() {
            RaisedException raised = RaisedException.snapshot(new ExceptionGroup("", new IllegalStateException()));

            assertThat(matcher.match(groupOf(IllegalStateException.class), raised).success()).isTrue();
        }
    }

    @Nested
    @DisplayName("options")
    class Options {

        @Test
        @DisplayName("flatten_subgroups ignores nesting depth")
        void flatten() {
            var raised = new ExceptionGroup("", new ExceptionGroup("", new IllegalStateException()));
            GroupSpec strict = groupOf(IllegalStateException.class);

            assertThat(matcher.match(strict, raised).diagnostic())
                    .isEqualTo("inner 'ExceptionGroup' is not of type 'IllegalStateException'\n"
                            + "Did you mean to use `flatten_subgroups=True`?");
            assertThat(matcher.matches(strict.withFlattenSubgroups(true), raised)).isTrue();
        }

        @Test
        @DisplayName("allow_unwrapped accepts the lone exception")
        void unwrapped() {
            GroupSpec strict = groupOf(IllegalStateException.class);

            assertThat(matcher.match(strict, new IllegalStateException("x")).diagnostic())
                    .isEqualTo("'IllegalStateException' is not an exception group, but would match with"
                            + " `allow_unwrapped=True`");
            assertThat(matcher.matches(strict.withAllowUnwrapped(true), new IllegalStateException("x")))
                    .isTrue();
            assertThat(matcher.matches(strict.withAllowUnwrapped(true), new ExceptionGroup("", new IllegalStateException())))
                    .isTrue();
        }

        @Test
        @DisplayName("allow_unwrapped reports the child's own reason for a wrong lone exception")
        void unwrappedMismatch() {
            GroupSpec spec = groupOf(IllegalStateException.class).withAllowUnwrapped(true);

            assertThat(matcher.match(spec, new IllegalArgumentException()).diagnostic())
                    .isEqualTo("'IllegalArgumentException' is not of type 'IllegalStateException'");
        }

        @Test
        @DisplayName("explicit group type is checked")
        void explicitType() {
            GroupSpec spec = group().expect(IllegalStateException.class)
                    .exceptionType(BaseExceptionGroup.class)
                    .build();

            assertThat(matcher.match(spec, new ExceptionGroup("", new IllegalStateException())).diagnostic())
                    .isEqualTo("'ExceptionGroup' is not of type 'BaseExceptionGroup'");
            assertThat(matcher.matches(spec, new BaseExceptionGroup("", new IllegalStateException())))
                    .isTrue();
        }

        @Test
        @DisplayName("base-only children")
        void baseChildren() {
            var raised = new BaseExceptionGroup("fatal", new StackOverflowError(), new IllegalStateException());

            assertThat(matcher.matches(groupOf(StackOverflowError.class, IllegalStateException.class), raised))
                    .isTrue();
        }
    }

    @Nested
    @DisplayName("patterns and checks")
    class PatternsAndChecks {

        @Test
        @DisplayName("group pattern is searched in message and notes")
        void groupPatternSeesNotes() {
            GroupSpec spec = group().expect(IllegalStateException.class).match("retry \\d").build();
            var raised = new ExceptionGroup("batch failed", new IllegalStateException());

            assertThat(matcher.match(spec, raised).diagnostic())
                    .isEqualTo("Regex pattern 'retry \\\\d' did not match 'batch failed'");
            raised.addNote("retry 3");
            assertThat(matcher.matches(spec, raised)).isTrue();
        }

        @Test
        @DisplayName("child matcher reason is prefixed with its canonical form")
        void childMatcherPrefix() {
            ExpectedSpec child = ExpectedSpec.matcher(IllegalStateException.class).match("^foo$").build();

            assertThat(matcher.match(group(child), new ExceptionGroup("", new IllegalStateException("bar")))
                            .diagnostic())
                    .isEqualTo("Matcher(IllegalStateException, match='^foo$'): Regex pattern '^foo$' did not match 'bar'");
        }

        @Test
        @DisplayName("top-level check failure names the check")
        void topLevelCheck() {
            NamedCheck hasNotes = NamedCheck.of("has_notes", e -> !((ThrowableGroup) e).notes().isEmpty());
            GroupSpec spec = group().expect(IllegalStateException.class).check(hasNotes).build();

            assertThat(matcher.match(spec, new ExceptionGroup("", new IllegalStateException())).diagnostic())
                    .isEqualTo("check has_notes did not return true");
        }

        @Test
        @DisplayName("nested check failure relies on the prefix to name the check")
        void nestedCheck() {
            NamedCheck isDisk = NamedCheck.of("is_disk", e -> "disk".equals(e.getMessage()));
            ExpectedSpec child = ExpectedSpec.matcher(IllegalStateException.class).check(isDisk).build();

            assertThat(matcher.match(group(child), new ExceptionGroup("", new IllegalStateException("net")))
                            .diagnostic())
                    .isEqualTo("Matcher(IllegalStateException, check=is_disk): check did not return true");
            assertThat(matcher.matches(group(child), new ExceptionGroup("", new IllegalStateException("disk"))))
                    .isTrue();
        }

        @Test
        @DisplayName("type is checked before the pattern")
        void typeBeforePattern() {
            ExpectedSpec spec = ExpectedSpec.matcher(IllegalStateException.class).match("x").build();

            assertThat(matcher.match(spec, new IllegalArgumentException("y")).diagnostic())
                    .isEqualTo("'IllegalArgumentException' is not of type 'IllegalStateException'");
        }
    }

    @Nested
    @DisplayName("assertMatches")
    class AssertMatches {

        @Test
        @DisplayName("returns normally on a match")
        void passes() {
            matcher.assertMatches(groupOf(IllegalStateException.class), new ExceptionGroup("", new IllegalStateException()));
        }

        @Test
        @DisplayName("group root uses the group prefix and keeps the raised exception as cause")
        void groupPrefix() {
            var raised = new ExceptionGroup("", new IllegalArgumentException());

            assertThatThrownBy(() -> matcher.assertMatches(groupOf(IllegalStateException.class), raised))
                    .isInstanceOf(AssertionError.class)
                    .hasMessage("Raised exception group did not match: "
                            + "'IllegalArgumentException' is not of type 'IllegalStateException'")
                    .hasCause(raised);
        }

        @Test
        @DisplayName("unwrapping root uses the (group) prefix")
        void unwrappedPrefix() {
            GroupSpec spec = groupOf(IllegalStateException.class).withAllowUnwrapped(true);

            assertThatThrownBy(() -> matcher.assertMatches(spec, new IllegalArgumentException()))
                    .hasMessageStartingWith("Raised exception (group) did not match: ");
        }

        @Test
        @DisplayName("non-group root uses the plain prefix")
        void lonePrefix() {
            assertThatThrownBy(() -> matcher.assertMatches(type(IllegalStateException.class), new IllegalArgumentException()))
                    .hasMessageStartingWith("Raised exception did not match: ");
        }

        @Test
        @DisplayName("nothing raised names what was expected")
        void nothingRaised() {
            assertThatThrownBy(() -> matcher.assertMatches(groupOf(IllegalStateException.class), null))
                    .isInstanceOf(AssertionError.class)
                    .hasMessage("DID NOT RAISE any exception, expected ExceptionGroup(IllegalStateException)");
        }
    }

    @Test
    @DisplayName("describe uses the configured check display")
    void describeUsesCheckDisplay() {
        GroupMatcher custom = GroupMatcher.builder().checkDisplay(check -> "<fn>").build();

        assertThat(custom.describe(ExpectedSpec.matcher().check(e -> true).build())).isEqualTo("Matcher(check=<fn>)");
    }
}
