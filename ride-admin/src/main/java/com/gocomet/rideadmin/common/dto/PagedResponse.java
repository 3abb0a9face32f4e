package com.gocomet.rideadmin.common.dto;

import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Page-number pagination envelope. {@code next} and {@code previous} are
 * absolute URLs, or null at either end.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PagedResponse<T> {

    private long count;
    private String next;
    private String previous;

    @Builder.Default
    private List<T> results = new ArrayList<>();
}
