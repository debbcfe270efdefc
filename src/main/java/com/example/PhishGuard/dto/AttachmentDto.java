package com.example.PhishGuard.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A raw uploaded file as it arrived: declared name, declared type and bytes.
 * In JSON the bytes travel base64-encoded in {@code data}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AttachmentDto {
    private String filename;
    private String contentType;
    private byte[] data;
}
