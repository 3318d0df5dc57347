package io.argbind.core.scan;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.argbind.core.error.MissingArgException;
import io.argbind.core.model.Args;
import java.util.List;
import org.junit.jupiter.api.Test;

class RequiredArgsTest {

    private static final Args FORM = Args.parse("exchange=NSE&tradingsymbol=&quantity=1");
    private static final Args QUERY = Args.parse("tradingsymbol=INFY");

    @Test
    void passesWhenEveryNameIsProvidedBySomeSource() {
        assertThatCode(() -> RequiredArgs.check(List.of("exchange", "tradingsymbol", "quantity"), FORM, QUERY))
                .doesNotThrowAnyException();
    }

    @Test
    void emptyValueCountsAsMissing() {
        assertThatThrownBy(() -> RequiredArgs.check(List.of("exchange", "tradingsymbol"), FORM))
                .isInstanceOf(MissingArgException.class)
                .hasMessage("Missing or empty field `tradingsymbol`");
    }

    @Test
    void reportsFirstMissingNameInOrder() {
        assertThatThrownBy(() -> RequiredArgs.check(List.of("a", "b"), FORM, QUERY))
                .isInstanceOf(MissingArgException.class)
                .hasMessage("Missing or empty field `a`");
    }

    @Test
    void noNamesAlwaysPasses() {
        assertThatCode(() -> RequiredArgs.check(List.of())).doesNotThrowAnyException();
    }
}
