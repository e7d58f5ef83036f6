package com.e2eq.odata.error;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ODataErrorResponse {
    private ODataError error;
}
