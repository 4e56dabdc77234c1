package com.github.stormino.audioextract.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConversionParameters")
class ConversionParametersTest {

    @Nested
    @DisplayName("defaults")
    class DefaultsTests {

        @Test
        @DisplayName("should default to 192k stereo mp3")
        void shouldDefaultToStereoMp3() {
            ConversionParameters params = ConversionParameters.builder().build();

            assertEquals("mp3", params.getOutputFormat());
            assertNull(params.getCodec());
            assertEquals("libmp3lame", params.resolveCodec());
            assertEquals("192k", params.getBitrate());
            assertEquals(44100, params.getSampleRate());
            assertEquals(2, params.getChannels());
            assertEquals(-1.0, params.getPeakTarget());
            assertNull(params.getStreamIndex());
            assertFalse(params.isNormalizeLoudness());
        }

        @Test
        @DisplayName("should fill missing JSON fields with defaults")
        void shouldFillMissingJsonFields() throws Exception {
            ConversionParameters params = new ObjectMapper()
                    .readValue("{\"outputFormat\":\"flac\"}", ConversionParameters.class);

            assertEquals("flac", params.getOutputFormat());
            assertNull(params.getCodec());
            assertEquals("flac", params.resolveCodec());
            assertEquals("192k", params.getBitrate());
            assertEquals(44100, params.getSampleRate());
        }
    }

    @Nested
    @DisplayName("validate")
    class ValidateTests {

        @Test
        @DisplayName("should accept defaults and trim times")
        void shouldAcceptValidParameters() {
            ConversionParameters params = ConversionParameters.builder()
                    .startTime("00:00:10")
                    .endTime("00:01:00.250")
                    .streamIndex(1)
                    .build();

            assertDoesNotThrow(params::validate);
        }

        @ParameterizedTest
        @ValueSource(strings = {"10", "0:0:10", "00:00:10.12345", "soon"})
        @DisplayName("should reject malformed start times")
        void shouldRejectMalformedStartTime(String startTime) {
            ConversionParameters params = ConversionParameters.builder().startTime(startTime).build();

            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, params::validate);
            assertTrue(ex.getMessage().contains("start time"));
        }

        @Test
        @DisplayName("should reject non-positive sample rate and channels")
        void shouldRejectNonPositiveNumbers() {
            assertThrows(IllegalArgumentException.class,
                    () -> ConversionParameters.builder().sampleRate(0).build().validate());
            assertThrows(IllegalArgumentException.class,
                    () -> ConversionParameters.builder().channels(-2).build().validate());
        }

        @Test
        @DisplayName("should reject negative stream index")
        void shouldRejectNegativeStream() {
            assertThrows(IllegalArgumentException.class,
                    () -> ConversionParameters.builder().streamIndex(-1).build().validate());
        }
    }

    @Nested
    @DisplayName("defaultCodecFor")
    class DefaultCodecForTests {

        @ParameterizedTest
        @CsvSource({
            "mp3, libmp3lame",
            "WAV, pcm_s16le",
            "m4a, aac",
            "flac, flac",
            "ogg, libvorbis",
            "opus, libmp3lame"
        })
        @DisplayName("should map output formats to encoders")
        void shouldMapFormatsToEncoders(String format, String codec) {
            assertEquals(codec, ConversionParameters.defaultCodecFor(format));
        }

        @Test
        @DisplayName("should fall back to the format encoder when the codec is blank")
        void shouldResolveBlankCodecFromFormat() {
            ConversionParameters params = ConversionParameters.builder().outputFormat("ogg").codec(" ").build();

            assertDoesNotThrow(params::validate);
            assertEquals("libvorbis", params.resolveCodec());
        }

        @Test
        @DisplayName("should keep an explicit codec")
        void shouldKeepExplicitCodec() {
            ConversionParameters params = ConversionParameters.builder().outputFormat("m4a").codec("alac").build();

            assertEquals("alac", params.resolveCodec());
        }
    }
}
