package com.coursegen.orchestrator.stage;

import com.coursegen.orchestrator.config.CourseGenProperties;
import com.coursegen.orchestrator.content.ScriptTemplates;
import com.coursegen.orchestrator.fallback.ChainResult;
import com.coursegen.orchestrator.fallback.FallbackChain;
import com.coursegen.orchestrator.fallback.Producer;
import com.coursegen.orchestrator.fallback.ProducerInvoker;
import com.coursegen.orchestrator.fallback.ProducerResult;
import com.coursegen.orchestrator.fallback.TierPolicy;
import com.coursegen.orchestrator.media.MediaException;
import com.coursegen.orchestrator.media.OsSpeechSynthesizer;
import com.coursegen.orchestrator.media.WaveformSynthesizer;
import com.coursegen.orchestrator.model.LessonSpec;
import com.coursegen.orchestrator.provider.ProviderCalls;
import com.coursegen.orchestrator.provider.TtsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Narration audio for one lesson: neural TTS, then the OS speech engine,
 * then a synthetic tone as long as the script would take to read.
 */
@Component
public class SpeechAudioSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(SpeechAudioSynthesizer.class);

    /** Encoded audio plus its file extension. */
    record Audio(byte[] bytes, String format) {}

    record Request(LessonSpec lesson, String spokenText, double estimatedMinutes, Path workDir) {}

    private final FallbackChain<Request, Audio> chain;

    public SpeechAudioSynthesizer(TtsProvider tts, OsSpeechSynthesizer osSpeech, WaveformSynthesizer waveform,
                                  ProducerInvoker invoker, CourseGenProperties props) {
        this.chain = FallbackChain.<Request, Audio>builder("speech-audio", invoker)
                .tier(Producer.of(tts.name(), req -> ProviderCalls.attempt(
                              () -> new Audio(tts.synthesize(req.spokenText()), tts.audioFormat()))),
                      TierPolicy.of(props.timeouts().speech(), props.retry().maxAttempts()))
                .tier(Producer.of("os-tts", req -> osSpeech(osSpeech, req)),
                      TierPolicy.of(props.timeouts().speech()))
                .terminal("waveform", req -> new Audio(waveform.tone(req.estimatedMinutes() * 60), "wav"))
                .build();
    }

    /** @return the audio file, written under {@code workDir} */
    public Path synthesize(LessonSpec lesson, SpeechScript script, Path workDir) {
        ChainResult<Audio> result = chain.execute(new Request(lesson, ScriptTemplates.spokenText(script.text()),
                script.estimatedMinutes(), workDir));
        Audio audio = result.value();
        Path file = ArtifactFiles.write(workDir.resolve(ArtifactFiles.name(lesson, "audio." + audio.format())),
                audio.bytes());
        log.info("Narration for lesson {} from {} (tier {})", lesson.number(), result.producer(), result.tier());
        return file;
    }

    private static ProducerResult<Audio> osSpeech(OsSpeechSynthesizer osSpeech, Request req) {
        if (!osSpeech.isConfigured()) {
            return ProducerResult.misconfigured("No OS speech command configured");
        }
        Path wav = req.workDir().resolve(ArtifactFiles.name(req.lesson(), "os-tts.wav"));
        try {
            osSpeech.synthesize(req.spokenText(), wav);
            return ProducerResult.ok(new Audio(Files.readAllBytes(wav), "wav"));
        } catch (MediaException | IOException e) {
            return ProducerResult.providerError(osSpeech.command() + ": " + e.getMessage());
        }
    }
}
