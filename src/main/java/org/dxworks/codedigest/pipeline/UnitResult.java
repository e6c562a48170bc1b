package org.dxworks.codedigest.pipeline;

import java.util.Objects;

/**
 * Per-unit outcome of a batch. {@link #getDigest()} is present for digested units and for units
 * whose summary did not fit the budget.
 */
public final class UnitResult {
    private final String unitName;
    private final UnitStatus status;
    private final DigestResult digest;
    private final String error;

    private UnitResult(String unitName, UnitStatus status, DigestResult digest, String error) {
        this.unitName = Objects.requireNonNull(unitName, "unitName");
        this.status = status;
        this.digest = digest;
        this.error = error;
    }

    public static UnitResult of(DigestResult digest) {
        UnitStatus status = digest.getFitResult().fits() ? UnitStatus.DIGESTED : UnitStatus.INPUT_TOO_LARGE;
        String error = digest.getFitResult().fits() ? null : digest.getFitResult().toString();
        return new UnitResult(digest.getUnitName(), status, digest, error);
    }

    public static UnitResult failed(String unitName, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new UnitResult(unitName, UnitStatus.FAILED, null, message);
    }

    public static UnitResult cancelled(String unitName) {
        return new UnitResult(unitName, UnitStatus.CANCELLED, null, null);
    }

    public String getUnitName() {
        return unitName;
    }

    public UnitStatus getStatus() {
        return status;
    }

    public DigestResult getDigest() {
        return digest;
    }

    public String getError() {
        return error;
    }
}
