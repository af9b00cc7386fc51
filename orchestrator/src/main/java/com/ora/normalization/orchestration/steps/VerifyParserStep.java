package com.ora.normalization.orchestration.steps;

import com.ora.normalization.config.MigrationProperties;
import com.ora.normalization.exception.SchemaException;
import com.ora.normalization.orchestration.MigrationContext;
import com.ora.normalization.orchestration.MigrationStep;
import com.ora.normalization.parser.ParseResult;
import com.ora.normalization.parser.RecordParser;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Prework step checking that the record parser splits the configured sample identifier.
 */
@Component
@RequiredArgsConstructor
public class VerifyParserStep implements MigrationStep {

    private final RecordParser recordParser;
    private final MigrationProperties properties;

    @Override
    public void execute(MigrationContext context) {
        MigrationProperties.PreworkConfig prework = properties.getPrework();
        ParseResult result = recordParser.parse(prework.getParserSample());

        if (!(result instanceof ParseResult.Valid valid)
                || !valid.baseCode().equals(prework.getParserSampleBase())
                || !Objects.equals(valid.subCode(), prework.getParserSampleSub())) {
            throw new SchemaException(String.format(
                "Parser returned %s for '%s', expected base %s and lot %s",
                result, prework.getParserSample(), prework.getParserSampleBase(), prework.getParserSampleSub()));
        }
        context.getAuditLog().info("  ✓ Parser verified: '{}' -> SKU {}, lot {}",
            prework.getParserSample(), valid.baseCode(), valid.subCode());
    }

    @Override
    public String getStepName() {
        return "Verify record parser";
    }
}
