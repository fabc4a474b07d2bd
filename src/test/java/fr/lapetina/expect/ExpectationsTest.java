package fr.lapetina.expect;

import fr.lapetina.expect.api.Act;
import fr.lapetina.expect.api.ThrowableExpect;
import fr.lapetina.expect.infrastructure.reporting.ExpectationError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;

import static fr.lapetina.expect.Expectations.expect;
import static fr.lapetina.expect.Expectations.expectObject;
import static fr.lapetina.expect.Expectations.expectThrown;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpectationsTest {

    private record Person(String name, int age) {
    }

    @Test
    @DisplayName("should pass when the subject equals the expected value")
    void shouldPassOnEqualSubject() {
        assertThatCode(() -> expect(42).toEqual(42).notToEqual(41)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should report the first failing assertion immediately")
    void shouldReportImmediately() {
        assertThatThrownBy(() -> expect("hello").toEqual("world").toEqual("never reached"))
                .isInstanceOf(ExpectationError.class)
                .hasMessage("expected the subject: \"hello\"\n"
                        + "◆ to equal: \"world\"");
    }

    @Test
    @DisplayName("should accept a null subject")
    void shouldAcceptNullSubject() {
        Object nothing = null;

        assertThatCode(() -> expect(nothing).toEqual(null)).doesNotThrowAnyException();
        assertThatThrownBy(() -> expect(nothing).notToEqual(null))
                .isInstanceOf(ExpectationError.class)
                .hasMessage("expected the subject: null\n"
                        + "◆ not to equal: null");
    }

    @Test
    @DisplayName("should compare instances by identity")
    void shouldCompareInstancesByIdentity() {
        Person alice = new Person("Alice", 30);
        Person twin = new Person("Alice", 30);

        assertThatCode(() -> expect(alice).toBeTheInstance(alice).notToBeTheInstance(twin).toEqual(twin))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> expect(alice).toBeTheInstance(twin))
                .isInstanceOf(ExpectationError.class)
                .hasMessageContaining("◆ to be the instance: Person[name=Alice, age=30]");
    }

    @Test
    @DisplayName("should report all failing assertions of an assertion creator together")
    void shouldReportAllFailuresOfCreator() {
        Person alice = new Person("Alice", 30);

        assertThatThrownBy(() -> expectObject(alice, person -> {
            person.feature("name", Person::name).toEqual("Bob");
            person.feature("age", Person::age).toEqual(30);
            person.feature("age", Person::age).notToEqual(30);
        }))
                .isInstanceOf(ExpectationError.class)
                .hasMessage("expected the subject: Person[name=Alice, age=30]\n"
                        + "◆ ▶ name: \"Alice\"\n"
                        + "    ◾ to equal: \"Bob\"\n"
                        + "◆ ▶ age: 30\n"
                        + "    ◾ not to equal: 30");
    }

    @Test
    @DisplayName("should fail when an assertion creator defines nothing")
    void shouldFailOnEmptyCreator() {
        assertThatThrownBy(() -> expectObject("hello", subject -> {
        }))
                .isInstanceOf(ExpectationError.class)
                .hasMessage("expected the subject: \"hello\"\n"
                        + "◆ at least one expectation defined: false\n"
                        + "    » You forgot to define expectations in the assertion creator");
    }

    @Test
    @DisplayName("should group feature assertions defined in a creator")
    void shouldGroupFeatureAssertions() {
        Person alice = new Person("Alice", 30);

        assertThatCode(() -> expect(alice).feature("name", Person::name, name -> name.toEqual("Alice")))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> expect(alice).feature("name", Person::name, name -> name
                .notToEqual("Alice")
                .toEqual("Bob")))
                .isInstanceOf(ExpectationError.class)
                .hasMessage("expected the subject: Person[name=Alice, age=30]\n"
                        + "◆ ▶ name: \"Alice\"\n"
                        + "    ◾ not to equal: \"Alice\"\n"
                        + "    ◾ to equal: \"Bob\"");
    }

    @Test
    @DisplayName("should report a feature that could not be extracted")
    void shouldReportFailedExtraction() {
        assertThatThrownBy(() -> expect("abc").feature("char at 5", s -> s.charAt(5)).toEqual('x'))
                .isInstanceOf(ExpectationError.class)
                .hasMessageContaining("◆ ▶ char at 5: ❗❗ could not extract char at 5: StringIndexOutOfBoundsException")
                .hasMessageContaining("    ◾ to equal: 'x'");
    }

    @Test
    @DisplayName("should narrow the subject to the expected type")
    void shouldNarrowSubject() {
        Object subject = "hello";

        assertThatCode(() -> expect(subject).toBeAnInstanceOf(String.class).feature("length", String::length).toEqual(5))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> expect(subject).toBeAnInstanceOf(Integer.class))
                .isInstanceOf(ExpectationError.class)
                .hasMessage("expected the subject: \"hello\"\n"
                        + "◆ to be an instance of type: java.lang.Integer");
    }

    @Test
    @DisplayName("should fail assertions on a subject which could not be narrowed")
    void shouldFailAssertionsAfterFailedNarrowing() {
        Object subject = "hello";

        assertThatThrownBy(() -> expectObject(subject, s -> s.toBeAnInstanceOf(Integer.class).toEqual(5)))
                .isInstanceOf(ExpectationError.class)
                .hasMessage("expected the subject: \"hello\"\n"
                        + "◆ to be an instance of type: java.lang.Integer\n"
                        + "◆ to equal: 5");
    }

    @Test
    @DisplayName("should pass when the expected exception is thrown")
    void shouldPassWhenExpectedExceptionThrown() {
        assertThatCode(() -> expectThrown(() -> Integer.parseInt("forty-two"))
                .toThrow(NumberFormatException.class)
                .messageToContain("forty-two"))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should accept a subtype of the expected exception")
    void shouldAcceptSubtypeOfExpectedException() {
        assertThatCode(() -> expectThrown(() -> {
            throw new IllegalStateException("boom");
        }).toThrow(RuntimeException.class)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should report what was thrown instead of the expected exception")
    void shouldReportOtherThrownException() {
        assertThatThrownBy(() -> expectThrown(() -> {
            throw new IllegalStateException("boom");
        }).toThrow(IllegalArgumentException.class))
                .isInstanceOf(ExpectationError.class)
                .hasMessageStartingWith("expected the thrown exception: java.lang.IllegalStateException: \"boom\"\n"
                        + "◆ to throw: java.lang.IllegalArgumentException\n"
                        + "    » thrown: java.lang.IllegalStateException\n"
                        + "    » message: \"boom\"\n"
                        + "    » at ");
    }

    @Test
    @DisplayName("should report that nothing was thrown")
    void shouldReportNothingThrown() {
        assertThatThrownBy(() -> expectThrown(() -> {
        }).toThrow(IllegalStateException.class))
                .isInstanceOf(ExpectationError.class)
                .hasMessage("expected the thrown exception: ❗❗ nothing was thrown\n"
                        + "◆ to throw: java.lang.IllegalStateException\n"
                        + "    » nothing was thrown");
    }

    @Test
    @DisplayName("should pass notToThrow when the act returns normally")
    void shouldPassNotToThrow() {
        assertThatCode(() -> expectThrown(() -> Integer.parseInt("42")).notToThrow()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should fail notToThrow when the act throws")
    void shouldFailNotToThrow() {
        assertThatThrownBy(() -> expectThrown(() -> {
            throw new UncheckedIOException(new IOException("disk full"));
        }).notToThrow())
                .isInstanceOf(ExpectationError.class)
                .hasMessageContaining("◆ not to: throw\n"
                        + "    » thrown: java.io.UncheckedIOException\n"
                        + "    » message: \"java.io.IOException: disk full\"");
    }

    @Test
    @DisplayName("should report missing parts of the exception message")
    void shouldReportMissingMessageParts() {
        assertThatThrownBy(() -> expectThrown(() -> {
            throw new IllegalStateException("boom");
        }).toThrow(IllegalStateException.class).messageToContain("boo", "bang"))
                .isInstanceOf(ExpectationError.class)
                .hasMessage("expected the thrown exception: java.lang.IllegalStateException: \"boom\"\n"
                        + "◆ ▶ message: \"boom\"\n"
                        + "    ◾ to contain: \"bang\"");
    }

    @Test
    @DisplayName("should reject a null expected message part")
    void shouldRejectNullMessagePart() {
        ThrowableExpect<IllegalStateException> thrown = expectThrown(() -> {
            throw new IllegalStateException("boom");
        }).toThrow(IllegalStateException.class);

        assertThatThrownBy(() -> thrown.messageToContain("boom", (String) null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("Expected value is required");
    }

    @Test
    @DisplayName("should make expectations about the cause")
    void shouldExpectCause() {
        Act failing = () -> {
            throw new IllegalStateException("outer", new IOException("inner"));
        };

        assertThatCode(() -> expectThrown(failing).toThrow(IllegalStateException.class)
                .cause(IOException.class)
                .messageToContain("inner"))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> expectThrown(failing).toThrow(IllegalStateException.class)
                .cause(IllegalArgumentException.class))
                .isInstanceOf(ExpectationError.class)
                .hasMessageContaining("◆ ▶ cause: java.io.IOException: \"inner\"\n"
                        + "    ◾ to be an instance of type: java.lang.IllegalArgumentException");
    }
}
