package com.nodepulse.importer.validation;

import com.nodepulse.importer.model.MeasurementRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.function.Predicate;

/**
 * Per-type validation of measurement records.
 *
 * <p>Only types with a registered check are inspected. A record whose type
 * has no check is accepted: the database enforces table existence, keys and
 * column types at import, so those are not duplicated here.</p>
 */
public class MeasurementValidator implements RecordValidator {

    private static final Logger logger = LoggerFactory.getLogger(MeasurementValidator.class);

    static final String PING = "MONROE.EXP.PING";

    private final Map<String, Predicate<MeasurementRecord>> checks;

    public MeasurementValidator() {
        this(Map.of(PING, MeasurementValidator::checkPing));
    }

    public MeasurementValidator(Map<String, Predicate<MeasurementRecord>> checks) {
        this.checks = Map.copyOf(checks);
    }

    @Override
    public boolean accepts(MeasurementRecord record, int verbosity) {
        String dataId = record.dataId();
        if (dataId == null) {
            if (verbosity > 1) {
                logger.debug("Validation failed: record has no {}", MeasurementRecord.DATA_ID_FIELD);
            }
            return false;
        }

        Predicate<MeasurementRecord> check = checks.get(dataId);
        if (check == null) {
            if (verbosity > 1) {
                logger.debug("No validity check for DataId {}, accepting", dataId);
            }
            return true;
        }

        boolean valid = check.test(record);
        if (!valid && verbosity > 1) {
            logger.debug("Validation failed for DataId {}: {}", dataId, record.fields());
        }
        return valid;
    }

    static boolean checkPing(MeasurementRecord record) {
        return atLeast(record, "SequenceNumber", 0, true)
                && atLeast(record, "Rtt", 0, false)
                && atLeast(record, "Bytes", 0, false)
                && atLeast(record, "TimeStamp", 0, false);
    }

    private static boolean atLeast(MeasurementRecord record, String field, double bound, boolean inclusive) {
        if (!(record.get(field) instanceof Number number)) {
            return false;
        }
        double value = number.doubleValue();
        return inclusive ? value >= bound : value > bound;
    }
}
