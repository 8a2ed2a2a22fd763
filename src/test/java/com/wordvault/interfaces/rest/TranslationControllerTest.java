package com.wordvault.interfaces.rest;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.wordvault.application.QueryService;
import com.wordvault.domain.ExampleTranslation;
import com.wordvault.domain.SenseTranslation;
import com.wordvault.dto.BackfillResult;
import com.wordvault.dto.ExampleTranslationUpdate;
import com.wordvault.dto.SenseTranslationUpdate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(TranslationController.class)
class TranslationControllerTest {
  private static final String ID = "3f2504e0-4f89-11d3-9a0c-0305e82c3301";

  @Autowired MockMvc mvc;

  @MockBean QueryService query;

  @Test
  @DisplayName("Example backfill reports updated and skipped counts")
  void testBackfillExamples() throws Exception {
    when(query.backfillExamples(
            List.of(
                new ExampleTranslationUpdate(ID, "Lleva un paraguas."),
                new ExampleTranslationUpdate("nope", "x"))))
        .thenReturn(new BackfillResult(1, 1));

    mvc.perform(
            post("/examples/translations/update")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"updates\":["
                        + "{\"id\":\"" + ID + "\",\"translatedText\":\"Lleva un paraguas.\"},"
                        + "{\"id\":\"nope\",\"translatedText\":\"x\"}]}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.updated").value(1))
        .andExpect(jsonPath("$.skipped").value(1));
  }

  @Test
  @DisplayName("Sense backfill accepts either translated form")
  void testBackfillSenses() throws Exception {
    when(query.backfillSenses(List.of(new SenseTranslationUpdate(ID, null, "llevar"))))
        .thenReturn(new BackfillResult(1, 0));

    mvc.perform(
            post("/senses/translations/update")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"updates\":[{\"id\":\"" + ID + "\","
                        + "\"definitionTranslatedShort\":\"llevar\"}]}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.updated").value(1));
  }

  @Test
  @DisplayName("Translations are read back by id")
  void testReadBack() throws Exception {
    when(query.exampleTranslations(List.of(ID)))
        .thenReturn(List.of(new ExampleTranslation(ID, "Lleva un paraguas.")));
    when(query.senseTranslations(List.of(ID)))
        .thenReturn(List.of(new SenseTranslation(ID, "llevar algo", "llevar")));

    mvc.perform(
            post("/examples/translations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"ids\":[\"" + ID + "\"]}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value(ID))
        .andExpect(jsonPath("$[0].translatedText").value("Lleva un paraguas."));
    mvc.perform(
            post("/senses/translations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"ids\":[\"" + ID + "\"]}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].definitionTranslatedShort").value("llevar"));
  }

  @Test
  @DisplayName("Empty or unreadable bodies are rejected before reaching the service")
  void testRejectsBadBodies() throws Exception {
    mvc.perform(
            post("/examples/translations/update")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"updates\":[]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.type").value("invalid_input"));
    mvc.perform(
            post("/senses/translations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"ids\":"))
        .andExpect(status().isBadRequest());
    verifyNoInteractions(query);
  }
}
