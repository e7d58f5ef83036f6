package com.e2eq.odata.error;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of the OData error envelope: {@code {"error": {code, message, target?, details?, innererror?}}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ODataError {
    private String code;
    private String message;
    private String target;
    private List<Detail> details;
    private InnerError innererror;

    /**
     * HTTP status matching {@link #code}; 500 for codes outside the taxonomy.
     */
    @JsonIgnore
    public int getHttpStatus() {
        return ODataErrorCode.fromCode(code)
                .map(ODataErrorCode::getHttpStatus)
                .orElse(500);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Detail(String code, String message, String target) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record InnerError(String message, String type, String stacktrace) {}
}
