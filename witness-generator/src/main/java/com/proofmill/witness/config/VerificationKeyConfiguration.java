package com.proofmill.witness.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.proofmill.witness.circuit.LeafLayerParameters;
import com.proofmill.witness.circuit.VerificationKey;
import com.proofmill.witness.circuit.VerificationParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Loads the recursion-layer verification parameters once at startup.
 *
 * The resulting {@link VerificationParameters} bean is immutable and handed
 * to stages by constructor; nothing looks keys up at job time.
 * A missing or unreadable key file fails startup.
 */
@Configuration
public class VerificationKeyConfiguration {

    private static final Logger log = LoggerFactory.getLogger(VerificationKeyConfiguration.class);

    private static final TypeReference<List<LeafLayerParameters>> LEAF_PARAMS_TYPE = new TypeReference<>() {};

    @Bean
    VerificationParameters verificationParameters(
            @Value("${witness.keys.node-layer-vk}") Resource nodeLayerVk,
            @Value("${witness.keys.leaf-layer-parameters}") Resource leafLayerParameters,
            ObjectMapper objectMapper) {
        VerificationKey nodeVk = read(nodeLayerVk, objectMapper, VerificationKey.class);
        List<LeafLayerParameters> leafParams;
        try (InputStream in = leafLayerParameters.getInputStream()) {
            leafParams = objectMapper.readValue(in, LEAF_PARAMS_TYPE);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load leaf layer parameters from " + leafLayerParameters, e);
        }
        log.info("Loaded node layer vk (circuit type {}) and {} leaf layer parameters",
                nodeVk.circuitType(), leafParams.size());
        return new VerificationParameters(nodeVk, leafParams);
    }

    private static <T> T read(Resource resource, ObjectMapper objectMapper, Class<T> type) {
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, type);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load " + type.getSimpleName() + " from " + resource, e);
        }
    }
}
