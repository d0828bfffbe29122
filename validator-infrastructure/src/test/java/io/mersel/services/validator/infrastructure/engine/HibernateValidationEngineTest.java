package io.mersel.services.validator.infrastructure.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.mersel.services.validator.application.constraints.FieldName;
import io.mersel.services.validator.application.constraints.Rule;
import io.mersel.services.validator.application.interfaces.UnknownRuleException;
import io.mersel.services.validator.application.interfaces.ValidationEngineException;
import io.mersel.services.validator.application.models.Violation;
import io.mersel.services.validator.infrastructure.rules.RuleRegistry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * HibernateValidationEngine birim testleri.
 */
@DisplayName("HibernateValidationEngine")
class HibernateValidationEngineTest {

    static class Address {
        @Rule("required")
        private String city;

        @JsonProperty("zip")
        @Rule("postal_check")
        private String postalCode;

        Address(String city, String postalCode) {
            this.city = city;
            this.postalCode = postalCode;
        }
    }

    static class Customer {
        @FieldName("Name")
        @Rule("required")
        @Rule(value = "min", param = "3")
        private String name;

        @Size(min = 2, max = 5)
        private String nick;

        @Max(120)
        private Integer age;

        @FieldName("-")
        @NotNull
        private String hidden;

        @Valid
        private Address address;

        Customer(String name, String nick, Integer age, String hidden, Address address) {
            this.name = name;
            this.nick = nick;
            this.age = age;
            this.hidden = hidden;
            this.address = address;
        }
    }

    static class Broken {
        @Rule("does_not_exist")
        private String value = "x";
    }

    static class Credentials {
        private String password;

        @FieldName("Confirmation")
        @Rule("required")
        @Rule(value = "eqfield", param = "password")
        private String confirm;

        Credentials(String password, String confirm) {
            this.password = password;
            this.confirm = confirm;
        }
    }

    static class Team {
        @Rule("required")
        private String title;

        @Valid
        private List<Credentials> members;

        Team(String title, List<Credentials> members) {
            this.title = title;
            this.members = members;
        }
    }

    static class MissingSibling {
        @Rule(value = "nefield", param = "nope")
        private String value = "x";
    }

    private HibernateValidationEngine engine;

    @BeforeEach
    void setUp() {
        var registry = RuleRegistry.withBuiltins();
        registry.register("postal_check", ctx -> ctx.valueAsString().length() == 10);
        engine = new HibernateValidationEngine(registry);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static Customer invalidCustomer() {
        return new Customer("ab", "x", 130, null, new Address("", "123"));
    }

    @Nested
    @DisplayName("Bean doğrulama")
    class Struct {

        @Test
        @DisplayName("gecerli — valid bean has no violations")
        void gecerli() {
            var customer = new Customer("Ali", "ali", 30, "h", new Address("Tehran", "1234567890"));

            assertThat(engine.validateStruct(customer)).isEmpty();
        }

        @Test
        @DisplayName("kural_adlari — registry and standard constraints reported with params")
        void kural_adlari() {
            List<Violation> violations = engine.validateStruct(invalidCustomer());

            assertThat(violations)
                    .extracting(Violation::field, Violation::structField, Violation::rule, Violation::param)
                    .containsExactly(
                            tuple("Name", "name", "min", "3"),
                            tuple("nick", "nick", "size", "5"),
                            tuple("age", "age", "max", "120"),
                            tuple("", "hidden", "not_null", ""),
                            tuple("city", "city", "required", ""),
                            tuple("zip", "postalCode", "postal_check", ""));
        }

        @Test
        @DisplayName("varsayilan_mesaj — registry rules carry the rule-name message")
        void varsayilan_mesaj() {
            var violation = engine.validateStruct(invalidCustomer()).get(0);

            assertThat(violation.message()).isEqualTo("failed on the 'min' rule");
        }

        @Test
        @DisplayName("tekrarlanan_kural — each repeated rule evaluated")
        void tekrarlanan_kural() {
            var customer = new Customer("", "ali", 30, "h", new Address("Tehran", "1234567890"));

            assertThat(engine.validateStruct(customer))
                    .extracting(Violation::rule)
                    .containsExactly("min", "required");
        }

        @Test
        @DisplayName("except — nested paths excluded through their parent")
        void except() {
            var violations = engine.validateStructExcept(invalidCustomer(), List.of("address", "Customer.nick", "age"));

            assertThat(violations).extracting(Violation::structField).containsExactly("name", "hidden");
        }

        @Test
        @DisplayName("partial — nested path selected directly")
        void partial() {
            var violations = engine.validateStructPartial(invalidCustomer(), List.of("address.city", "name"));

            assertThat(violations).extracting(Violation::structField).containsExactly("name", "city");
        }

        @Test
        @DisplayName("partial_bos — no fields selects nothing")
        void partial_bos() {
            assertThat(engine.validateStructPartial(invalidCustomer(), List.of())).isEmpty();
        }

        @Test
        @DisplayName("bilinmeyen_kural — unknown @Rule propagates as runtime exception")
        void bilinmeyen_kural() {
            assertThatThrownBy(() -> engine.validateStruct(new Broken()))
                    .isInstanceOf(RuntimeException.class)
                    .hasStackTraceContaining("does_not_exist");
        }

        static Stream<Object> nonBeans() {
            return Stream.of("text", 42, true, 'c', Thread.State.NEW, List.of(), Map.of(), Optional.empty(),
                    new int[]{1}, Set.of());
        }

        @ParameterizedTest(name = "{0}")
        @MethodSource("nonBeans")
        @DisplayName("bean_olmayan — rejected with engine exception")
        void bean_olmayan(Object value) {
            assertThatThrownBy(() -> engine.validateStruct(value)).isInstanceOf(ValidationEngineException.class);
        }

        @Test
        @DisplayName("null — rejected with engine exception")
        void nullDeger() {
            assertThatThrownBy(() -> engine.validateStruct(null)).isInstanceOf(ValidationEngineException.class);
        }
    }

    @Nested
    @DisplayName("Alan karşılaştırma")
    class FieldComparison {

        @Test
        @DisplayName("esit — equal sibling values pass eqfield")
        void esit() {
            assertThat(engine.validateStruct(new Credentials("secret", "secret"))).isEmpty();
        }

        @Test
        @DisplayName("farkli — differing sibling values fail eqfield with the sibling as param")
        void farkli() {
            assertThat(engine.validateStruct(new Credentials("secret", "typo")))
                    .extracting(Violation::field, Violation::structField, Violation::rule, Violation::param, Violation::message)
                    .containsExactly(tuple("Confirmation", "confirm", "eqfield", "password", "failed on the 'eqfield' rule"));
        }

        @Test
        @DisplayName("ic_ice — nested list elements compared within their own bean")
        void ic_ice() {
            var team = new Team("", List.of(new Credentials("a", "a"), new Credentials("b", "c")));

            assertThat(engine.validateStruct(team))
                    .extracting(Violation::structField, Violation::rule)
                    .containsExactly(tuple("title", "required"), tuple("confirm", "eqfield"));
            assertThat(engine.validateStructPartial(team, List.of("members[1].confirm")))
                    .extracting(Violation::rule)
                    .containsExactly("eqfield");
            assertThat(engine.validateStructExcept(team, List.of("members"))).extracting(Violation::rule)
                    .containsExactly("required");
        }

        @Test
        @DisplayName("kardes_yok — unknown sibling field is an engine error")
        void kardes_yok() {
            assertThatThrownBy(() -> engine.validateStruct(new MissingSibling()))
                    .isInstanceOf(ValidationEngineException.class)
                    .hasMessageContaining("nope");
        }
    }

    @Nested
    @DisplayName("Değişken doğrulama")
    class Var {

        @Test
        @DisplayName("ilk_hata — single violation for first failing rule")
        void ilk_hata() {
            var violations = engine.validateVar("ab", "required,min=3,max=1");

            assertThat(violations).hasSize(1);
            assertThat(violations.get(0).rule()).isEqualTo("min");
            assertThat(violations.get(0).param()).isEqualTo("3");
            assertThat(violations.get(0).field()).isEmpty();
            assertThat(violations.get(0).message()).isEqualTo("failed on the 'min' rule");
        }

        @Test
        @DisplayName("gecerli — no violations")
        void gecerli() {
            assertThat(engine.validateVar("abc", "required,min=3")).isEmpty();
        }

        @Test
        @DisplayName("bos_ifade — blank expression validates nothing")
        void bos_ifade() {
            assertThat(engine.validateVar("", " ")).isEmpty();
        }

        @Test
        @DisplayName("omitempty — empty values short-circuit")
        void omitempty() {
            assertThat(engine.validateVar(null, "omitempty,min=3")).isEmpty();
            assertThat(engine.validateVar("ab", "omitempty,min=3")).extracting(Violation::rule).containsExactly("min");
        }

        @Test
        @DisplayName("kacisli_parametre — escaped comma inside oneof")
        void kacisli_parametre() {
            assertThat(engine.validateVar("a,b", "oneof=a0x2Cb c")).isEmpty();
        }

        @Test
        @DisplayName("with_value — eqfield uses other")
        void withValue() {
            assertThat(engine.validateVarWithValue("x", "x", "eqfield")).isEmpty();
            assertThat(engine.validateVarWithValue("x", "y", "eqfield")).extracting(Violation::rule)
                    .containsExactly("eqfield");
        }

        @Test
        @DisplayName("bilinmeyen — UnknownRuleException")
        void bilinmeyen() {
            assertThatThrownBy(() -> engine.validateVar("x", "required,nope"))
                    .isInstanceOf(UnknownRuleException.class);
        }

        @Test
        @DisplayName("kayit — registerRule makes the rule available")
        void kayit() {
            engine.registerRule("even", ctx -> ((Integer) ctx.value()) % 2 == 0);

            assertThat(engine.getRuleNames()).contains("even");
            assertThat(engine.validateVar(4, "even")).isEmpty();
            assertThat(engine.validateVar(3, "even")).hasSize(1);
        }
    }
}
