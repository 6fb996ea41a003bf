package com.gocomet.ridebooking.ride.dto;

import lombok.*;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RideHistoryResponse {

    private List<RideResponse> rides;
    private PaginationInfo pagination;
}
