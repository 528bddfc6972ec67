package com.ogt.tapak.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UploadResponseDTO {

    private String status;

    @JsonProperty("inserted_rows")
    private int insertedRows;

    public static UploadResponseDTO ok(int insertedRows) {
        return new UploadResponseDTO("ok", insertedRows);
    }
}
