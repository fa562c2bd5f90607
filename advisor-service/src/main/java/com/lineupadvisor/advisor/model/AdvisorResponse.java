package com.lineupadvisor.advisor.model;

import com.lineupadvisor.common.model.DataQualitySummary;

import java.util.List;

/**
 * Envelope for every advisor endpoint.
 *
 * @param status      SUCCESS, PARTIAL (answer built from incomplete data) or ERROR
 * @param payload     lineup, draft ranking or strategy list; {@code null} on ERROR
 * @param warnings    non-fatal problems met while answering
 * @param dataQuality signal coverage of the players considered; {@code null} when not applicable
 * @param error       reason for an ERROR response
 */
public record AdvisorResponse<T>(
    ResponseStatus status,
    T payload,
    List<String> warnings,
    DataQualitySummary dataQuality,
    String error
) {
    public AdvisorResponse {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static <T> AdvisorResponse<T> of(boolean partial, T payload, List<String> warnings,
                                            DataQualitySummary dataQuality) {
        return new AdvisorResponse<>(partial ? ResponseStatus.PARTIAL : ResponseStatus.SUCCESS,
            payload, warnings, dataQuality, null);
    }

    public static <T> AdvisorResponse<T> success(T payload) {
        return new AdvisorResponse<>(ResponseStatus.SUCCESS, payload, List.of(), null, null);
    }

    public static <T> AdvisorResponse<T> error(String message) {
        return new AdvisorResponse<>(ResponseStatus.ERROR, null, List.of(), null, message);
    }
}
