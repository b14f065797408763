package com.example.statements.service;

import com.example.statements.domain.Recipient;
import com.example.statements.domain.Recipient.Frequency;
import com.example.statements.repository.GroupMembershipRepository;
import com.example.statements.repository.RecipientRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Decides which recipients are due a scheduled statement on a given day.
 */
@Service
@Transactional(readOnly = true)
public class DueRecipientService {

    private final RecipientRepository recipientRepository;
    private final GroupMembershipRepository membershipRepository;

    public DueRecipientService(RecipientRepository recipientRepository,
                               GroupMembershipRepository membershipRepository) {
        this.recipientRepository = recipientRepository;
        this.membershipRepository = membershipRepository;
    }

    /**
     * Active recipients whose schedule falls on {@code today}, excluding customers that are
     * members of a group. Ordered by name, case-insensitive.
     */
    public List<Recipient> findDueRecipients(LocalDate today) {
        Set<Long> groupedIds = membershipRepository.findGroupedMemberIds();
        return recipientRepository.findByActiveTrueOrderByNameAsc().stream()
            .filter(r -> !groupedIds.contains(r.getId()))
            .filter(r -> isDue(r, today))
            .sorted(Comparator.comparing(Recipient::getName, String.CASE_INSENSITIVE_ORDER))
            .toList();
    }

    /**
     * Schedule check for one recipient. Day of week is 0 for Monday through 6 for Sunday.
     */
    public boolean isDue(Recipient recipient, LocalDate today) {
        if (!recipient.isActive()) {
            return false;
        }
        Frequency frequency = recipient.getFrequency();
        if (frequency == null || frequency == Frequency.NONE) {
            return false;
        }
        LocalDate lastSent = recipient.getLastSent();
        int weekday = today.getDayOfWeek().getValue() - 1;

        return switch (frequency) {
            case WEEKLY -> weekday == recipient.getDayOfWeek()
                && (lastSent == null || ChronoUnit.DAYS.between(lastSent, today) >= 7);
            case BIWEEKLY -> weekday == recipient.getDayOfWeek()
                && (lastSent == null || ChronoUnit.DAYS.between(lastSent, today) >= 14);
            case MONTHLY -> today.getDayOfMonth() == recipient.getDayOfMonth()
                && (lastSent == null
                    || lastSent.getMonthValue() != today.getMonthValue()
                    || lastSent.getYear() != today.getYear());
            case NONE -> false;
        };
    }
}
