package com.ogt.tapak.controller;

import com.ogt.tapak.config.SecurityConfig;
import com.ogt.tapak.config.TapakProperties;
import com.ogt.tapak.dto.UploadResponseDTO;
import com.ogt.tapak.exception.BadInputException;
import com.ogt.tapak.exception.ConversionException;
import com.ogt.tapak.exception.StagingBusyException;
import com.ogt.tapak.upload.UploadService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = UploadController.class, properties = "tapak.api-key=test-secret")
class UploadControllerTest {

    private static final String API_KEY = "test-secret";

    @TestConfiguration
    @EnableConfigurationProperties(TapakProperties.class)
    @Import(SecurityConfig.class)
    static class Config {
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private UploadService uploadService;

    private final MockMultipartFile zip =
            new MockMultipartFile("file", "tapak.zip", "application/zip", new byte[]{'P', 'K', 3, 4});

    @Test
    void rejectsRequestWithoutApiKey() throws Exception {
        mockMvc.perform(multipart("/upload").file(zip))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.detail").value("Invalid or missing API key"));

        verify(uploadService, never()).uploadAsync(any(), any());
    }

    @Test
    void rejectsWrongApiKey() throws Exception {
        mockMvc.perform(multipart("/upload").file(zip).header("X-API-Key", "nope"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void returnsInsertedRows() throws Exception {
        when(uploadService.validate(any())).thenReturn("tapak.zip");
        when(uploadService.uploadAsync(eq("tapak.zip"), any()))
                .thenReturn(CompletableFuture.completedFuture(UploadResponseDTO.ok(4)));

        MvcResult started = mockMvc.perform(multipart("/upload").file(zip).header("X-API-Key", API_KEY))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(started))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.inserted_rows").value(4));
    }

    @Test
    void invalidFileIsBadRequestWithoutStartingWork() throws Exception {
        when(uploadService.validate(any()))
                .thenThrow(new BadInputException("Upload a .zip file containing a shapefile (.shp .dbf .shx .prj)"));

        mockMvc.perform(multipart("/upload").file(zip).header("X-API-Key", API_KEY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"));

        verify(uploadService, never()).uploadAsync(any(), any());
    }

    @Test
    void missingFilePartIsBadRequest() throws Exception {
        mockMvc.perform(multipart("/upload").header("X-API-Key", API_KEY))
                .andExpect(status().isBadRequest());
    }

    @Test
    void conversionFailureIsServerErrorWithDetail() throws Exception {
        when(uploadService.validate(any())).thenReturn("tapak.zip");
        when(uploadService.uploadAsync(eq("tapak.zip"), any()))
                .thenReturn(CompletableFuture.failedFuture(new ConversionException("ogr2ogr failed (exit 1)", "ERROR 1")));

        MvcResult started = mockMvc.perform(multipart("/upload").file(zip).header("X-API-Key", API_KEY))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(started))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value("ogr2ogr failed (exit 1): ERROR 1"));
    }

    @Test
    void busyStagingIsServiceUnavailable() throws Exception {
        when(uploadService.validate(any())).thenReturn("tapak.zip");
        when(uploadService.uploadAsync(eq("tapak.zip"), any()))
                .thenReturn(CompletableFuture.failedFuture(new StagingBusyException("public.staging_tapak_upload")));

        MvcResult started = mockMvc.perform(multipart("/upload").file(zip).header("X-API-Key", API_KEY))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(started))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void saturatedPoolIsServiceUnavailable() throws Exception {
        when(uploadService.validate(any())).thenReturn("tapak.zip");
        when(uploadService.uploadAsync(eq("tapak.zip"), any()))
                .thenThrow(new TaskRejectedException("Executor did not accept task"));

        mockMvc.perform(multipart("/upload").file(zip).header("X-API-Key", API_KEY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.detail").value("Server busy, try again later"));
    }
}
