package org.blockindex.migrations.aws;

import java.util.Optional;

import org.blockindex.migrations.pipeline.common.TransientStoreException;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import software.amazon.awssdk.services.ssm.model.InternalServerErrorException;
import software.amazon.awssdk.services.ssm.model.ParameterTier;
import software.amazon.awssdk.services.ssm.model.ParameterType;

import static org.junit.jupiter.api.Assertions.*;

class SsmCheckpointStoreTest {

    private static final String KEY = "/migrate-block-index/prod/last-evaluated/1/0";

    private final FakeSsm ssm = new FakeSsm();
    private final SsmCheckpointStore store = new SsmCheckpointStore(ssm);

    @Test
    void missingParameterReadsAsEmpty() {
        StepVerifier.create(store.get(KEY))
            .expectNext(Optional.empty())
            .verifyComplete();
    }

    @Test
    void putOverwritesAStandardStringParameter() {
        ssm.withParameter(KEY, "old");

        StepVerifier.create(store.put(KEY, "{\"recordsScanned\":500}")).verifyComplete();
        StepVerifier.create(store.get(KEY))
            .expectNext(Optional.of("{\"recordsScanned\":500}"))
            .verifyComplete();

        var put = ssm.getPuts().get(0);
        assertEquals(ParameterType.STRING, put.type());
        assertEquals(ParameterTier.STANDARD, put.tier());
        assertTrue(put.overwrite());
    }

    @Test
    void serverErrorsAreTransient() {
        ssm.failingWith(InternalServerErrorException.builder().statusCode(500).message("boom").build());

        StepVerifier.create(store.get(KEY))
            .expectError(TransientStoreException.class)
            .verify();
    }
}
