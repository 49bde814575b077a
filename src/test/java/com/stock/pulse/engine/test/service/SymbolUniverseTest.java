package com.stock.pulse.engine.test.service;

import com.stock.pulse.engine.common.constants.DefaultUniverse;
import com.stock.pulse.engine.common.exception.ValidationException;
import com.stock.pulse.engine.service.pipeline.SymbolUniverse;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SymbolUniverseTest {

    private final SymbolUniverse universe = new SymbolUniverse();

    @Test
    void defaultUniverse() {
        assertThat(universe.size()).isEqualTo(143);
        assertThat(universe.categories()).containsOnlyKeys(
                DefaultUniverse.NIFTY_50, DefaultUniverse.NIFTY_NEXT_50, DefaultUniverse.MID_SMALL_CAPS);
        assertThat(universe.categories().get(DefaultUniverse.NIFTY_50)).hasSize(50);
        assertThat(universe.all()).doesNotHaveDuplicates();
    }

    @Test
    void addGoesToMidSmallCapsByDefault() {
        SymbolUniverse.ChangeResult r = universe.add(List.of(" zomato2 ", "", "RELIANCE"), null);

        assertThat(r.changed()).containsExactly("ZOMATO2");
        assertThat(r.unchanged()).containsExactly("RELIANCE");
        assertThat(r.totalSymbols()).isEqualTo(144);
        assertThat(universe.categories().get(DefaultUniverse.MID_SMALL_CAPS)).contains("ZOMATO2");
    }

    @Test
    void addCreatesANewCategory() {
        universe.add(List.of("NEWA", "NEWB"), "Watch_List");

        assertThat(universe.categories().get("watch_list")).containsExactly("NEWA", "NEWB");
        assertThat(universe.all()).endsWith("NEWA", "NEWB");
    }

    @Test
    void invalidCategoryIsRejected() {
        assertThatThrownBy(() -> universe.add(List.of("X"), "bad name!"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("bad name!");
        assertThat(universe.size()).isEqualTo(143);
    }

    @Test
    void removeReportsUnknownSymbols() {
        SymbolUniverse.ChangeResult r = universe.remove(List.of("tcs", "NOTHERE"));

        assertThat(r.changed()).containsExactly("TCS");
        assertThat(r.unchanged()).containsExactly("NOTHERE");
        assertThat(r.totalSymbols()).isEqualTo(142);
        assertThat(universe.all()).doesNotContain("TCS");
    }
}
