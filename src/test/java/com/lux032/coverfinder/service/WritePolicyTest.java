package com.lux032.coverfinder.service;

import com.lux032.coverfinder.model.WriteAction;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class WritePolicyTest {

    @ParameterizedTest(name = "discovered={0} existing={1} update={2} force={3} -> {4}")
    @CsvSource({
        "false, false, false, false, NONE",
        "false, true,  true,  true,  NONE",
        "true,  false, false, false, WRITE",
        "true,  false, true,  true,  WRITE",
        "true,  true,  false, false, KEEP",
        "true,  true,  false, true,  KEEP",
        "true,  true,  true,  false, KEEP",
        "true,  true,  true,  true,  OVERWRITE"
    })
    void shouldFollowFieldPolicyTable(boolean discovered, boolean existing, boolean update, boolean force,
                                      WriteAction expected) {
        assertThat(WritePolicy.decide(discovered, existing, update, force)).isEqualTo(expected);
    }

    @ParameterizedTest(name = "resolved={0} existing={1} force={2} -> {3}")
    @CsvSource({
        "false, false, false, NONE",
        "false, true,  true,  NONE",
        "false, true,  false, KEEP",
        "true,  false, false, WRITE",
        "true,  true,  false, KEEP",
        "true,  true,  true,  OVERWRITE"
    })
    void shouldFollowArtworkPolicy(boolean resolved, boolean existing, boolean force, WriteAction expected) {
        assertThat(WritePolicy.decideArtwork(resolved, existing, force)).isEqualTo(expected);
    }
}
