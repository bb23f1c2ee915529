package com.healthcoach.backend.users.profile;

import com.healthcoach.backend.coach.model.Preferences;
import com.healthcoach.backend.users.profile.controller.UserProfileController;
import com.healthcoach.backend.users.profile.dto.UpsertProfileRequest;
import com.healthcoach.backend.users.profile.dto.UserProfileDto;
import com.healthcoach.backend.users.profile.service.UserProfileService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Set;

import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ActiveProfiles("test")
@WebMvcTest(controllers = UserProfileController.class)
class UserProfileControllerTest {

    @Autowired MockMvc mvc;

    @MockitoBean UserProfileService svc;

    @Test
    void put_valid_shouldReturnDto() throws Exception {
        when(svc.upsert(eq(1L), any(UpsertProfileRequest.class))).thenReturn(new UserProfileDto(
                1L, 28, 75.0, 175.0, "male", "moderately_active",
                Set.of("weight_loss"), new Preferences(Set.of(), 45, 4, Set.of()), null));

        mvc.perform(put("/api/v1/users/1/profile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"age":28,"gender":"male","height":175,"weight":75,
                                 "activityLevel":"moderately_active","fitnessGoals":["weight_loss"]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value(1))
                .andExpect(jsonPath("$.fitnessGoals[0]").value("weight_loss"));
    }

    @Test
    void put_outOfRange_shouldReturn400WithFieldMessages() throws Exception {
        mvc.perform(put("/api/v1/users/1/profile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"age":12,"weight":301,"height":99,"gender":"robot","activityLevel":"lazy",
                                 "preferences":{"daysPerWeek":8}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.fields.age").value("Age must be between 13 and 120"))
                .andExpect(jsonPath("$.fields.weight").value("Weight must be between 30 and 300 kg"))
                .andExpect(jsonPath("$.fields.height").value("Height must be between 100 and 250 cm"))
                .andExpect(jsonPath("$.fields.gender").value("Gender must be male, female, or other"))
                .andExpect(jsonPath("$.fields.activityLevel").value("Invalid activity level"))
                .andExpect(jsonPath("$.fields['preferences.daysPerWeek']").exists());

        verify(svc, never()).upsert(any(), any());
    }

    @Test
    void put_tagWithComma_shouldReturn400() throws Exception {
        mvc.perform(put("/api/v1/users/1/profile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"fitnessGoals":["strength","low_fat,dairy_free"],
                                 "preferences":{"dietaryRestrictions":["vegan,gluten_free"]}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.fields.*", everyItem(is(UpsertProfileRequest.TAG_MESSAGE))))
                .andExpect(jsonPath("$.fields.*", hasSize(2)));

        verify(svc, never()).upsert(any(), any());
    }

    @Test
    void get_missing_shouldReturn404() throws Exception {
        when(svc.get(404L)).thenThrow(new IllegalStateException("PROFILE_NOT_FOUND"));

        mvc.perform(get("/api/v1/users/404/profile"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("PROFILE_NOT_FOUND"));
    }

    @Test
    void non_numeric_user_id_shouldReturn400() throws Exception {
        mvc.perform(get("/api/v1/users/abc/profile"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }
}
