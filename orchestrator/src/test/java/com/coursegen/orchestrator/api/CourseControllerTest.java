package com.coursegen.orchestrator.api;

import com.coursegen.orchestrator.model.ArtifactRecord;
import com.coursegen.orchestrator.model.GenerationJob;
import com.coursegen.orchestrator.model.JobStatus;
import com.coursegen.orchestrator.model.LessonId;
import com.coursegen.orchestrator.model.StageArtifact;
import com.coursegen.orchestrator.model.StageName;
import com.coursegen.orchestrator.model.TestJobs;
import com.coursegen.orchestrator.service.JobService;
import com.coursegen.orchestrator.service.JobTransitionException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web-layer slice: no database, no workers. JobService is a mock.
 */
@WebMvcTest(CourseController.class)
class CourseControllerTest {

    @Autowired MockMvc      mockMvc;
    @MockitoBean JobService jobService;

    // ------------------------------------------------------------------
    // POST /courses/generate
    // ------------------------------------------------------------------

    @Test
    void generate_validRequest_returns201WithJobId() throws Exception {
        GenerationJob job = TestJobs.job("Python data analysis");
        UUID doc = UUID.randomUUID();
        when(jobService.submit(eq("Python data analysis"), anyList())).thenReturn(job);

        mockMvc.perform(post("/courses/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"topic":"Python data analysis","document_ids":["%s"]}
                                """.formatted(doc)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.job_id").value(job.getId().toString()))
                .andExpect(jsonPath("$.status").value("PENDING"));

        verify(jobService).submit("Python data analysis", List.of(doc));
    }

    @Test
    void generate_withoutDocuments_passesEmptyList() throws Exception {
        GenerationJob job = TestJobs.job("Rust");
        when(jobService.submit(any(), anyList())).thenReturn(job);

        mockMvc.perform(post("/courses/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"topic\":\"Rust\"}"))
                .andExpect(status().isCreated());

        verify(jobService).submit("Rust", List.of());
    }

    @Test
    void generate_blankTopic_returns400() throws Exception {
        when(jobService.submit(any(), anyList())).thenThrow(new IllegalArgumentException("Topic must not be blank"));

        mockMvc.perform(post("/courses/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"topic\":\"  \"}"))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // GET /courses/{id}/status
    // ------------------------------------------------------------------

    @Test
    void status_runningJob_reportsProgressInSnakeCase() throws Exception {
        GenerationJob job = TestJobs.job("Kubernetes", JobStatus.PROCESSING);
        job.setProgress(45);
        when(jobService.findById(job.getId())).thenReturn(Optional.of(job));

        mockMvc.perform(get("/courses/{id}/status", job.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.job_id").value(job.getId().toString()))
                .andExpect(jsonPath("$.status").value("PROCESSING"))
                .andExpect(jsonPath("$.progress").value(45))
                .andExpect(jsonPath("$.created_at").isNotEmpty())
                .andExpect(jsonPath("$.result_url").doesNotExist())
                .andExpect(jsonPath("$.error_message").doesNotExist());
    }

    @Test
    void status_completedJob_includesResultUrl() throws Exception {
        GenerationJob job = TestJobs.job("Kubernetes", JobStatus.COMPLETED);
        job.setProgress(100);
        job.setResultReference("/data/courses/course_package_kubernetes.zip");
        when(jobService.findById(job.getId())).thenReturn(Optional.of(job));

        mockMvc.perform(get("/courses/{id}/status", job.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.progress").value(100))
                .andExpect(jsonPath("$.result_url").value("/data/courses/course_package_kubernetes.zip"));
    }

    @Test
    void status_failedJob_includesErrorMessage() throws Exception {
        GenerationJob job = TestJobs.job("Kubernetes", JobStatus.FAILED);
        job.setProgress(90);
        job.setErrorMessage("Packaging failed: disk full");
        when(jobService.findById(job.getId())).thenReturn(Optional.of(job));

        mockMvc.perform(get("/courses/{id}/status", job.getId()))
                .andExpect(jsonPath("$.status").value("FAILED"))
                .andExpect(jsonPath("$.progress").value(90))
                .andExpect(jsonPath("$.error_message").value("Packaging failed: disk full"));
    }

    @Test
    void status_unknownId_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(jobService.findById(unknown)).thenReturn(Optional.empty());

        mockMvc.perform(get("/courses/{id}/status", unknown))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // POST /courses/{id}/cancel
    // ------------------------------------------------------------------

    @Test
    void cancel_runningJob_returns200() throws Exception {
        GenerationJob job = TestJobs.job("Go", JobStatus.PROCESSING);
        when(jobService.cancel(job.getId())).thenReturn(job);

        mockMvc.perform(post("/courses/{id}/cancel", job.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PROCESSING"));
    }

    @Test
    void cancel_finishedJob_returns409() throws Exception {
        UUID id = UUID.randomUUID();
        when(jobService.cancel(id)).thenThrow(new JobTransitionException(id, JobStatus.COMPLETED, "cancel"));

        mockMvc.perform(post("/courses/{id}/cancel", id))
                .andExpect(status().isConflict());
    }

    @Test
    void cancel_unknownId_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(jobService.cancel(id)).thenThrow(new NoSuchElementException());

        mockMvc.perform(post("/courses/{id}/cancel", id))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // GET /courses/{id}/artifacts
    // ------------------------------------------------------------------

    @Test
    void artifacts_listsProducerAndDegradation() throws Exception {
        GenerationJob job = TestJobs.job("Go", JobStatus.COMPLETED);
        when(jobService.findById(job.getId())).thenReturn(Optional.of(job));
        StageArtifact<String> clip = new StageArtifact<>(LessonId.of(2), StageName.PRESENTER_VIDEOS,
                "videos/lesson_02_presenter.mp4", "placeholder-clip", 3, 3, true, List.of(), null);
        when(jobService.getArtifacts(job.getId()))
                .thenReturn(List.of(new ArtifactRecord(job.getId(), clip, "videos/lesson_02_presenter.mp4")));

        mockMvc.perform(get("/courses/{id}/artifacts", job.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].lesson_number").value(2))
                .andExpect(jsonPath("$[0].stage").value("PRESENTER_VIDEOS"))
                .andExpect(jsonPath("$[0].provider_used").value("placeholder-clip"))
                .andExpect(jsonPath("$[0].tier").value(3))
                .andExpect(jsonPath("$[0].degraded").value(true));
    }

    @Test
    void artifacts_unknownJob_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(jobService.findById(unknown)).thenReturn(Optional.empty());

        mockMvc.perform(get("/courses/{id}/artifacts", unknown))
                .andExpect(status().isNotFound());
    }
}
