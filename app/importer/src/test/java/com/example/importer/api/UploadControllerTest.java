package com.example.importer.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.importer.job.JobService;
import com.example.importer.model.JobKind;
import com.example.importer.model.JobRecord;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(UploadController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class UploadControllerTest {

  private static final UUID JOB_ID = UUID.fromString("00000000-0000-0000-0000-000000000202");

  @Autowired private MockMvc mockMvc;

  @MockBean private JobService jobService;

  @Test
  void csvUploadReturns202WithJobId() throws Exception {
    when(jobService.startImport(eq("products.csv"), any(InputStream.class)))
        .thenReturn(new JobRecord(JOB_ID, JobKind.IMPORT, "products.csv", Instant.now()));

    mockMvc
        .perform(multipart("/api/upload").file(csv("products.csv")))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.job_id").value(JOB_ID.toString()))
        .andExpect(jsonPath("$.status").value("queued"));
  }

  @Test
  void nonCsvUploadIsRejected() throws Exception {
    mockMvc
        .perform(multipart("/api/upload").file(csv("products.xlsx")))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Invalid file type. Expected .csv, got products.xlsx"));
    verifyNoInteractions(jobService);
  }

  @Test
  void missingFilePartIsRejected() throws Exception {
    mockMvc
        .perform(multipart("/api/upload"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("file is required"));
  }

  private static MockMultipartFile csv(String fileName) {
    return new MockMultipartFile(
        "file", fileName, "text/csv", "sku,name\nA1,Widget\n".getBytes(StandardCharsets.UTF_8));
  }
}
