package com.showbooking.booking.service;

import com.showbooking.booking.repository.SeatRepository;
import com.showbooking.booking.repository.ShowRepository;
import com.showbooking.common.dto.ShowDto;
import com.showbooking.common.entity.Seat;
import com.showbooking.common.entity.Show;
import com.showbooking.common.util.SeatLabels;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Show provisioning. A new show gets its full set of seats, all AVAILABLE, in the
 * same transaction that creates it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ShowService {

    private final ShowRepository showRepository;
    private final SeatRepository seatRepository;

    @Value("${booking.show.default-seat-count:30}")
    private int defaultSeatCount;

    @Value("${booking.show.max-seat-count:500}")
    private int maxSeatCount;

    /**
     * Create a show with seats laid out row by row
     *
     * @param name Show name, "Show" when blank
     * @param seatCount Number of seats, the configured default when null
     * @param seatsPerRow Seats per row, everything in row A when null
     */
    @Transactional
    public ShowDto createShow(String name, Integer seatCount, Integer seatsPerRow) {
        int count = seatCount != null ? seatCount : defaultSeatCount;
        if (count <= 0 || count > maxSeatCount) {
            throw new IllegalArgumentException(
                "Seat count must be between 1 and " + maxSeatCount + ": " + count);
        }
        int perRow = seatsPerRow != null ? seatsPerRow : count;
        if (perRow <= 0) {
            throw new IllegalArgumentException("Seats per row must be positive: " + perRow);
        }

        Show show = Show.builder()
            .name(StringUtils.hasText(name) ? name.trim() : Show.DEFAULT_NAME)
            .seatCount(count)
            .build();
        show = showRepository.save(show);

        List<Seat> seats = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String row = SeatLabels.rowName(i / perRow);
            int number = i % perRow + 1;
            seats.add(Seat.builder()
                .show(show)
                .rowLetter(row)
                .seatNumber(number)
                .label(SeatLabels.label(row, number))
                .status(Seat.SeatStatus.AVAILABLE)
                .build());
        }
        seatRepository.saveAll(seats);

        log.info("Show created: id={} name={} seats={} perRow={}", show.getId(), show.getName(), count, perRow);

        return convertToDto(show, count);
    }

    /**
     * All shows, newest first, with their current count of AVAILABLE seats
     */
    @Transactional(readOnly = true)
    public List<ShowDto> listShows() {
        return showRepository.findAllByOrderByCreatedAtDescIdDesc().stream()
            .map(show -> convertToDto(show,
                seatRepository.countByShowIdAndStatus(show.getId(), Seat.SeatStatus.AVAILABLE)))
            .toList();
    }

    private ShowDto convertToDto(Show show, long availableSeats) {
        return ShowDto.builder()
            .id(show.getId())
            .name(show.getName())
            .seatCount(show.getSeatCount())
            .availableSeats(availableSeats)
            .createdAt(show.getCreatedAt())
            .build();
    }
}
