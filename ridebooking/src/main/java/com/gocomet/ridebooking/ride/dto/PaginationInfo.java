package com.gocomet.ridebooking.ride.dto;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PaginationInfo {

    private int currentPage;
    private int totalPages;
    private long totalRides;
    private boolean hasNextPage;
    private boolean hasPrevPage;
}
