package com.questrail.harness.run.generator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Generates a single constant string. An absent constant generates the empty
 * string.
 */
public final class ConstantGenerator implements Generator<String>
{
    private static final Logger log = LoggerFactory.getLogger(ConstantGenerator.class);

    private final String constant;

    public ConstantGenerator(String constant)
    {
        this.constant = constant == null ? "" : constant;
    }

    @Override
    public List<String> generate()
    {
        log.debug("Generating '{}'", constant);
        return List.of(constant);
    }
}
