package de.elomagic.ddlexport.dto;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of a single DDL request.
 */
public final class ExportResult {

    public enum Kind {
        SUCCESS,
        FAILURE,
        // Requested object does not exist. Only used for package bodies
        ABSENT
    }

    private static final ExportResult ABSENT_RESULT = new ExportResult(Kind.ABSENT, null, null);

    public final Kind kind;
    public final String ddl;
    public final String errorDetail;

    private ExportResult(@NotNull Kind kind, @Nullable String ddl, @Nullable String errorDetail) {
        this.kind = kind;
        this.ddl = ddl;
        this.errorDetail = errorDetail;
    }

    @NotNull
    public static ExportResult success(@NotNull String ddl) {
        return new ExportResult(Kind.SUCCESS, ddl, null);
    }

    @NotNull
    public static ExportResult failure(@Nullable String errorDetail) {
        return new ExportResult(Kind.FAILURE, null, errorDetail);
    }

    @NotNull
    public static ExportResult absent() {
        return ABSENT_RESULT;
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case SUCCESS -> "SUCCESS";
            case FAILURE -> "FAILURE(" + errorDetail + ")";
            case ABSENT -> "ABSENT";
        };
    }

}
