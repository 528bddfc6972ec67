package com.ogt.tapak.controller;

import com.ogt.tapak.dto.UploadResponseDTO;
import com.ogt.tapak.upload.UploadService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

@RestController
@RequiredArgsConstructor
public class UploadController {

    private final UploadService uploadService;

    // POST /upload (multipart, campo "file" = ZIP con .shp .dbf .shx .prj)
    @PostMapping(path = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public CompletableFuture<ResponseEntity<UploadResponseDTO>> upload(@RequestParam("file") MultipartFile file) throws IOException {
        String fileName = uploadService.validate(file);
        byte[] content = file.getBytes();
        return uploadService.uploadAsync(fileName, content).thenApply(ResponseEntity::ok);
    }
}
