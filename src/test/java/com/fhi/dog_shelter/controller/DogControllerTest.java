package com.fhi.dog_shelter.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.fhi.dog_shelter.fixtures.annotation.Fixtures;
import com.fhi.dog_shelter.fixtures.annotation.SpringIntegrationTest;
import com.fhi.dog_shelter.model.Breed;
import com.fhi.dog_shelter.model.Dog;

import lombok.extern.slf4j.Slf4j;

// Shared fixtures: Buddy(1) and Charlie(4) are Labradors, Max(2) a German Shepherd,
// Daisy(3) and Bella(5) Beagles. No dog is a Poodle.
@SpringIntegrationTest
@Fixtures({ Breed.class, Dog.class })
@Slf4j
class DogControllerTest
{
    @Autowired
    private MockMvc mockMvc;


    // -----------------------------------------
    // GET /api/dogs
    // -----------------------------------------

    @DisplayName("Without a filter every dog is listed once, as id/name/breed")
    @Test
    void listAll() throws Exception
    {
        mockMvc.perform(get("/api/dogs"))
               .andExpect(status().isOk())
               .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
               .andExpect(jsonPath("$", hasSize(5)))
               .andExpect(jsonPath("$[*].id", contains(1, 2, 3, 4, 5)))
               .andExpect(content().json("["
                       + "{\"id\": 1, \"name\": \"Buddy\",   \"breed\": \"Labrador Retriever\"},"
                       + "{\"id\": 2, \"name\": \"Max\",     \"breed\": \"German Shepherd\"},"
                       + "{\"id\": 3, \"name\": \"Daisy\",   \"breed\": \"Beagle\"},"
                       + "{\"id\": 4, \"name\": \"Charlie\", \"breed\": \"Labrador Retriever\"},"
                       + "{\"id\": 5, \"name\": \"Bella\",   \"breed\": \"Beagle\"}"
                       + "]", true));
    }

    @DisplayName("A single breed keeps only the dogs of that breed")
    @Test
    void filterSingleBreed() throws Exception
    {
        mockMvc.perform(get("/api/dogs").param("breeds", "Labrador Retriever"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$[*].id", contains(1, 4)))
               .andExpect(jsonPath("$[*].breed", contains("Labrador Retriever", "Labrador Retriever")));
    }

    @DisplayName("Several breeds, with blanks around names and empty entries")
    @Test
    void filterSeveralBreeds() throws Exception
    {
        mockMvc.perform(get("/api/dogs").param("breeds", "  Beagle ,, German Shepherd , "))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$[*].name", contains("Max", "Daisy", "Bella")));
    }

    @DisplayName("An empty, blank or comma-only filter lists every dog")
    @Test
    void emptyFilter() throws Exception
    {
        for (String value : new String[] { "", "   ", ",,", " , " })
        {   log.debug("breeds = '{}'", value);
            mockMvc.perform(get("/api/dogs").param("breeds", value))
                   .andExpect(status().isOk())
                   .andExpect(jsonPath("$", hasSize(5)));
        }
    }

    @DisplayName("Breed names match exactly: no substring, no case folding")
    @Test
    void filterIsExactMatch() throws Exception
    {
        mockMvc.perform(get("/api/dogs").param("breeds", "Labrador"))
               .andExpect(status().isOk())
               .andExpect(content().json("[]", true));

        mockMvc.perform(get("/api/dogs").param("breeds", "beagle"))
               .andExpect(status().isOk())
               .andExpect(content().json("[]", true));
    }

    @DisplayName("Unknown breeds and breeds without dogs give an empty list, not an error")
    @Test
    void filterWithoutMatches() throws Exception
    {
        mockMvc.perform(get("/api/dogs").param("breeds", "Chihuahua,Poodle"))
               .andExpect(status().isOk())
               .andExpect(content().json("[]", true));
    }

    @DisplayName("Unknown names next to a known one are simply ignored")
    @Test
    void filterMixedKnownAndUnknown() throws Exception
    {
        mockMvc.perform(get("/api/dogs").param("breeds", "Chihuahua,German Shepherd"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$[*].id", contains(2)));
    }

    @DisplayName("Repeating a request gives the same body")
    @Test
    void listIsRepeatable() throws Exception
    {
        String first  = mockMvc.perform(get("/api/dogs").param("breeds", "Beagle"))
                               .andReturn().getResponse().getContentAsString();
        String second = mockMvc.perform(get("/api/dogs").param("breeds", "Beagle"))
                               .andReturn().getResponse().getContentAsString();

        assertThat(second).isEqualTo(first);
    }


    // -----------------------------------------
    // GET /api/dogs/{id}
    // -----------------------------------------

    @DisplayName("Detail of an existing dog with labels for gender and status")
    @Test
    void getById() throws Exception
    {
        mockMvc.perform(get("/api/dogs/{id}", 1))
               .andExpect(status().isOk())
               .andExpect(content().json("{"
                       + "\"id\": 1,"
                       + "\"name\": \"Buddy\","
                       + "\"breed\": \"Labrador Retriever\","
                       + "\"age\": 3,"
                       + "\"description\": \"Friendly and energetic.\","
                       + "\"gender\": \"Male\","
                       + "\"status\": \"AVAILABLE\""
                       + "}", true));
    }

    @DisplayName("Each status is reported by its symbolic name")
    @Test
    void getById_statuses() throws Exception
    {
        mockMvc.perform(get("/api/dogs/2"))
               .andExpect(jsonPath("$.status").value("PENDING"));

        mockMvc.perform(get("/api/dogs/3"))
               .andExpect(jsonPath("$.status").value("ADOPTED"))
               .andExpect(jsonPath("$.gender").value("Female"));
    }

    @DisplayName("Missing age and description come back as null")
    @Test
    void getById_nullableFields() throws Exception
    {
        mockMvc.perform(get("/api/dogs/5"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.name").value("Bella"))
               .andExpect(jsonPath("$.age").value(nullValue()))
               .andExpect(jsonPath("$.description").value(nullValue()));
    }

    @DisplayName("Unknown id gives 404 with the error body")
    @Test
    void getById_notFound() throws Exception
    {
        mockMvc.perform(get("/api/dogs/{id}", 99))
               .andExpect(status().isNotFound())
               .andExpect(content().json("{\"error\": \"Dog not found\"}", true));
    }

    @DisplayName("A non-numeric id matches no route and gives 404")
    @Test
    void getById_notNumeric() throws Exception
    {
        mockMvc.perform(get("/api/dogs/abc"))
               .andExpect(status().isNotFound());
    }

    @DisplayName("A numeric id beyond the long range is a bad request")
    @Test
    void getById_tooLarge() throws Exception
    {
        mockMvc.perform(get("/api/dogs/99999999999999999999"))
               .andExpect(status().isBadRequest());
    }
}
