package com.example.statements.service;

import com.example.statements.domain.GroupMembership;
import com.example.statements.domain.Recipient;
import com.example.statements.domain.Recipient.Frequency;
import com.example.statements.domain.Recipient.Kind;
import com.example.statements.domain.RecipientAlias;
import com.example.statements.domain.TermsCode;
import com.example.statements.repository.GroupMembershipRepository;
import com.example.statements.repository.RecipientAliasRepository;
import com.example.statements.repository.RecipientRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Service for managing statement recipients, their customer-name aliases and group membership.
 */
@Service
@Transactional
public class RecipientService {

    private static final Logger log = LoggerFactory.getLogger(RecipientService.class);

    private final RecipientRepository recipientRepository;
    private final RecipientAliasRepository aliasRepository;
    private final GroupMembershipRepository membershipRepository;

    public RecipientService(RecipientRepository recipientRepository,
                            RecipientAliasRepository aliasRepository,
                            GroupMembershipRepository membershipRepository) {
        this.recipientRepository = recipientRepository;
        this.aliasRepository = aliasRepository;
        this.membershipRepository = membershipRepository;
    }

    /**
     * Editable recipient settings as entered by an administrator. Raw values are normalized on save.
     */
    public record RecipientDetails(
        String name,
        String emailTo,
        String terms,
        String location,
        String frequency,
        Integer dayOfWeek,
        Integer dayOfMonth,
        boolean active
    ) {}

    /**
     * Creates a recipient.
     * @throws IllegalArgumentException if the name is taken or required fields are missing
     */
    public Recipient create(Kind kind, RecipientDetails details) {
        String name = requireName(details);
        if (recipientRepository.findByNameIgnoreCase(name).isPresent()) {
            throw new IllegalArgumentException("A customer or group already uses the name: " + name);
        }
        Recipient recipient = new Recipient(name, kind, null, TermsCode.DEFAULT);
        apply(recipient, details);
        recipient = recipientRepository.save(recipient);
        log.info("Created {} recipient {}", kind, name);
        return recipient;
    }

    /**
     * Updates a recipient's settings.
     * @throws IllegalArgumentException if the recipient is unknown or the new name is taken
     */
    public Recipient update(Long recipientId, RecipientDetails details) {
        Recipient recipient = getRequired(recipientId);
        String name = requireName(details);
        recipientRepository.findByNameIgnoreCase(name)
            .filter(other -> !other.getId().equals(recipientId))
            .ifPresent(other -> {
                throw new IllegalArgumentException("Another customer or group already uses the name: " + name);
            });
        recipient.setName(name);
        apply(recipient, details);
        return recipientRepository.save(recipient);
    }

    /**
     * Deletes a recipient together with its aliases and any memberships it is part of.
     */
    public void delete(Long recipientId) {
        Recipient recipient = getRequired(recipientId);
        membershipRepository.deleteByGroup(recipient);
        membershipRepository.deleteByMember(recipient);
        aliasRepository.deleteByRecipient(recipient);
        recipientRepository.delete(recipient);
        log.info("Deleted recipient {}", recipient.getName());
    }

    /**
     * Binds a customer name to a recipient. An existing alias of that name is moved.
     */
    public RecipientAlias addAlias(String customerName, Long recipientId) {
        if (customerName == null || customerName.isBlank()) {
            throw new IllegalArgumentException("Customer name is required");
        }
        Recipient recipient = getRequired(recipientId);
        String name = customerName.trim();
        RecipientAlias alias = aliasRepository.findByCustomerName(name)
            .orElseGet(() -> new RecipientAlias(name, recipient));
        alias.setRecipient(recipient);
        return aliasRepository.save(alias);
    }

    public void removeAlias(Long aliasId) {
        aliasRepository.deleteById(aliasId);
    }

    @Transactional(readOnly = true)
    public List<RecipientAlias> findAliases(Long recipientId) {
        return aliasRepository.findByRecipient(getRequired(recipientId));
    }

    /**
     * Replaces a group's members. Only single recipients can be members; a member moves out
     * of any group it previously belonged to.
     *
     * @return the members now assigned
     */
    public List<Recipient> setGroupMembers(Long groupId, Collection<Long> memberIds) {
        Recipient group = getRequired(groupId);
        if (!group.isGroup()) {
            throw new IllegalArgumentException(group.getName() + " is not a group");
        }

        List<Recipient> members = new ArrayList<>();
        for (Recipient candidate : recipientRepository.findAllById(new LinkedHashSet<>(memberIds))) {
            if (candidate.getKind() == Kind.SINGLE) {
                members.add(candidate);
            } else {
                log.warn("Ignoring non-single recipient {} as member of {}", candidate.getName(), group.getName());
            }
        }

        membershipRepository.deleteByGroup(group);
        for (Recipient member : members) {
            membershipRepository.findByMember(member).ifPresent(previous -> {
                log.info("Moving {} from group {} to {}", member.getName(),
                    previous.getGroup().getName(), group.getName());
                membershipRepository.delete(previous);
            });
        }
        membershipRepository.flush();
        for (Recipient member : members) {
            membershipRepository.save(new GroupMembership(group, member));
        }
        return members;
    }

    @Transactional(readOnly = true)
    public List<Recipient> findGroupMembers(Long groupId) {
        return membershipRepository.findByGroupId(groupId).stream()
            .map(GroupMembership::getMember)
            .toList();
    }

    @Transactional(readOnly = true)
    public Set<Long> groupedMemberIds() {
        return membershipRepository.findGroupedMemberIds();
    }

    @Transactional(readOnly = true)
    public List<Recipient> findAll() {
        return recipientRepository.findAllByOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public Optional<Recipient> findById(Long id) {
        return recipientRepository.findById(id);
    }

    // Normalization helpers, shared with the CSV import

    static Frequency parseFrequency(String value) {
        if (value == null || value.isBlank()) {
            return Frequency.WEEKLY;
        }
        try {
            return Frequency.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Frequency.WEEKLY;
        }
    }

    static int clamp(Integer value, int fallback, int min, int max) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Splits on commas and semicolons and rejoins with ", ".
     */
    static String normalizeEmails(String value) {
        if (value == null) {
            return null;
        }
        List<String> addresses = Arrays.stream(value.split("[,;]"))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
        return addresses.isEmpty() ? null : String.join(", ", addresses);
    }

    private void apply(Recipient recipient, RecipientDetails details) {
        String emails = normalizeEmails(details.emailTo());
        if (emails == null) {
            throw new IllegalArgumentException("Name and email are required");
        }
        recipient.setEmailTo(emails);
        recipient.setTermsCode(TermsCode.parseOrDefault(details.terms()));
        recipient.setLocation(details.location() != null ? details.location().trim() : null);
        recipient.setFrequency(parseFrequency(details.frequency()));
        recipient.setDayOfWeek(clamp(details.dayOfWeek(), 0, 0, 6));
        recipient.setDayOfMonth(clamp(details.dayOfMonth(), 1, 1, 28));
        recipient.setActive(details.active());
    }

    private String requireName(RecipientDetails details) {
        if (details.name() == null || details.name().isBlank()) {
            throw new IllegalArgumentException("Name and email are required");
        }
        return details.name().trim();
    }

    private Recipient getRequired(Long recipientId) {
        return recipientRepository.findById(recipientId)
            .orElseThrow(() -> new IllegalArgumentException("Recipient not found: " + recipientId));
    }
}
