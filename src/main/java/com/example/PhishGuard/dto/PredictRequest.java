package com.example.PhishGuard.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PredictRequest {
    @NotBlank(message = "subject cannot be empty or whitespace only")
    private String subject;

    @NotBlank(message = "body cannot be empty or whitespace only")
    private String body;

    /** 可选附件 */
    @Valid
    private List<AttachmentDto> attachments;
}
