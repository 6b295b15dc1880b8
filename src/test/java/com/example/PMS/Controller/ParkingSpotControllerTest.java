package com.example.PMS.Controller;

import com.example.PMS.DTO.CheckInRequestDTO;
import com.example.PMS.DTO.ParkingSpotCreateDTO;
import com.example.PMS.DTO.SpotSearchCriteria;
import com.example.PMS.Entities.ParkingSpot;
import com.example.PMS.Exceptions.BusinessException;
import com.example.PMS.Exceptions.ErrorCode;
import com.example.PMS.Exceptions.GlobalExceptionHandler;
import com.example.PMS.Services.ParkingSpotService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
public class ParkingSpotControllerTest {

    @Mock
    private ParkingSpotService parkingSpotService;

    @InjectMocks
    private ParkingSpotController parkingSpotController;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(parkingSpotController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static ParkingSpot spot(String status, String license) {
        ParkingSpot spot = new ParkingSpot();
        spot.setId("spot-1");
        spot.setSpotNumber("A1");
        spot.setSpotType("regular");
        spot.setStatus(status);
        spot.setOccupied("occupied".equals(status));
        spot.setVehicleLicense(license);
        spot.setCreatedAt(LocalDateTime.of(2024, 1, 1, 8, 0));
        return spot;
    }

    @Test
    void createSpot_ReturnsSnakeCaseSpot() throws Exception {
        when(parkingSpotService.createSpot(any(ParkingSpotCreateDTO.class))).thenReturn(spot("available", null));

        mockMvc.perform(post("/api/spots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"spot_number\":\"A1\",\"spot_type\":\"regular\",\"hourly_rate\":5.0}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("spot-1"))
                .andExpect(jsonPath("$.spot_number").value("A1"))
                .andExpect(jsonPath("$.status").value("available"))
                .andExpect(jsonPath("$.is_occupied").value(false))
                .andExpect(jsonPath("$.hourly_rate").value(5.0));

        verify(parkingSpotService).createSpot(argThat(dto ->
                "A1".equals(dto.getSpotNumber()) && "regular".equals(dto.getSpotType())
                        && Double.valueOf(5.0).equals(dto.getHourlyRate())));
    }

    @Test
    void createSpot_MissingSpotNumber_IsRejected() throws Exception {
        mockMvc.perform(post("/api/spots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"spot_type\":\"regular\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"));

        verifyNoInteractions(parkingSpotService);
    }

    @Test
    void createSpot_UnknownStatus_IsRejected() throws Exception {
        mockMvc.perform(post("/api/spots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"spot_number\":\"A1\",\"spot_type\":\"regular\",\"status\":\"closed\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(parkingSpotService);
    }

    @Test
    void createSpot_Duplicate_Returns400() throws Exception {
        when(parkingSpotService.createSpot(any(ParkingSpotCreateDTO.class)))
                .thenThrow(new BusinessException(ErrorCode.DUPLICATE_SPOT_NUMBER));

        mockMvc.perform(post("/api/spots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"spot_number\":\"A1\",\"spot_type\":\"regular\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Spot number already exists"));
    }

    @Test
    void getAllSpots_PassesFilters() throws Exception {
        when(parkingSpotService.listSpots(any(SpotSearchCriteria.class))).thenReturn(List.of(spot("occupied", "ABC123")));

        mockMvc.perform(get("/api/spots")
                        .param("status", "occupied")
                        .param("spot_type", "regular")
                        .param("search", "abc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].vehicle_license").value("ABC123"))
                .andExpect(jsonPath("$[0].is_occupied").value(true));

        verify(parkingSpotService).listSpots(new SpotSearchCriteria("occupied", "regular", "abc"));
    }

    @Test
    void updateSpot_BlankSpotType_IsRejected() throws Exception {
        mockMvc.perform(put("/api/spots/spot-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"spot_type\":\"  \"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(parkingSpotService);
    }

    @Test
    void checkIn_MissingLicense_IsRejected() throws Exception {
        mockMvc.perform(post("/api/spots/spot-1/checkin")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"driver_name\":\"Jane\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(parkingSpotService);
    }

    @Test
    void occupancyLifecycle() throws Exception {
        when(parkingSpotService.createSpot(any(ParkingSpotCreateDTO.class))).thenReturn(spot("available", null));
        when(parkingSpotService.checkIn(eq("spot-1"), any(CheckInRequestDTO.class)))
                .thenReturn(spot("occupied", "ABC123"))
                .thenThrow(new BusinessException(ErrorCode.SPOT_NOT_AVAILABLE));
        when(parkingSpotService.checkOut("spot-1"))
                .thenReturn(spot("available", null))
                .thenThrow(new BusinessException(ErrorCode.SPOT_NOT_OCCUPIED));
        when(parkingSpotService.getSpot("spot-1")).thenThrow(new BusinessException(ErrorCode.SPOT_NOT_FOUND));

        mockMvc.perform(post("/api/spots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"spot_number\":\"A1\",\"spot_type\":\"regular\",\"hourly_rate\":5.0}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("available"));

        mockMvc.perform(post("/api/spots/spot-1/checkin")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"vehicle_license\":\"ABC123\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("occupied"));

        mockMvc.perform(post("/api/spots/spot-1/checkin")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"vehicle_license\":\"XYZ789\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Parking spot is not available"));

        mockMvc.perform(post("/api/spots/spot-1/checkout"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("available"))
                .andExpect(jsonPath("$.vehicle_license").doesNotExist());

        mockMvc.perform(post("/api/spots/spot-1/checkout"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Parking spot is not occupied"));

        mockMvc.perform(delete("/api/spots/spot-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Parking spot deleted successfully"));

        mockMvc.perform(get("/api/spots/spot-1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Parking spot not found"));
    }

    @Test
    void unexpectedFailure_Returns500() throws Exception {
        when(parkingSpotService.getSpot("spot-1")).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(get("/api/spots/spot-1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("C002"));
    }

    @Test
    void createSpot_StoreDuplicateKey_Returns400() throws Exception {
        when(parkingSpotService.createSpot(any(ParkingSpotCreateDTO.class)))
                .thenThrow(new DuplicateKeyException("E11000 duplicate key error collection: parking_spots"));

        mockMvc.perform(post("/api/spots")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"spot_number\":\"A1\",\"spot_type\":\"regular\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("P002"))
                .andExpect(jsonPath("$.message").value("Spot number already exists"));
    }

    @Test
    void deleteCollection_Returns405() throws Exception {
        mockMvc.perform(delete("/api/spots"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.status").value(405))
                .andExpect(jsonPath("$.code").value("C003"));

        verifyNoInteractions(parkingSpotService);
    }

    @Test
    void checkIn_PlainTextBody_Returns415() throws Exception {
        mockMvc.perform(post("/api/spots/spot-1/checkin")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("ABC-123"))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.status").value(415))
                .andExpect(jsonPath("$.code").value("C003"));

        verifyNoInteractions(parkingSpotService);
    }
}
