package com.rdslens.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LoadDimensionTest {

    @Test
    void parsesAliases() {
        assertThat(LoadDimension.parse(null)).isEqualTo(LoadDimension.STATEMENT);
        assertThat(LoadDimension.parse("SQL")).isEqualTo(LoadDimension.STATEMENT);
        assertThat(LoadDimension.parse("db.user")).isEqualTo(LoadDimension.USER);
        assertThat(LoadDimension.parse("wait-event")).isEqualTo(LoadDimension.WAIT_EVENT);
        assertThatThrownBy(() -> LoadDimension.parse("host")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void classifiesEngines() {
        assertThat(EngineFamily.fromEngine("aurora-mysql")).isEqualTo(EngineFamily.MYSQL);
        assertThat(EngineFamily.fromEngine("aurora-postgresql")).isEqualTo(EngineFamily.POSTGRES);
        assertThat(EngineFamily.fromEngine("oracle-ee")).isEqualTo(EngineFamily.OTHER);
        assertThat(EngineFamily.fromEngine(null)).isEqualTo(EngineFamily.OTHER);
    }
}
