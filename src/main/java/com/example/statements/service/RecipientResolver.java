package com.example.statements.service;

import com.example.statements.domain.GroupMembership;
import com.example.statements.domain.Recipient;
import com.example.statements.domain.RecipientAlias;
import com.example.statements.repository.GroupMembershipRepository;
import com.example.statements.repository.RecipientAliasRepository;
import com.example.statements.repository.RecipientRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps raw customer names from an invoice export to dispatch recipients.
 *
 * <p>A name resolves through its own recipient record or an alias. Membership of an active
 * group wins over the single recipient, otherwise an active single recipient is used.
 * Anything else is unresolved. The lookup tables are rebuilt for every pass so edits to the
 * directory take effect immediately.
 */
@Service
@Transactional(readOnly = true)
public class RecipientResolver {

    private final RecipientRepository recipientRepository;
    private final RecipientAliasRepository aliasRepository;
    private final GroupMembershipRepository membershipRepository;

    public RecipientResolver(RecipientRepository recipientRepository,
                             RecipientAliasRepository aliasRepository,
                             GroupMembershipRepository membershipRepository) {
        this.recipientRepository = recipientRepository;
        this.aliasRepository = aliasRepository;
        this.membershipRepository = membershipRepository;
    }

    /**
     * Outcome of resolving one customer name.
     *
     * @param recipient the group or single recipient the invoice belongs to
     * @param customer the customer record the name matched, the group member for grouped names
     *                 or the group itself when the name is bound to the group directly
     */
    public record Resolution(Recipient recipient, Recipient customer) {
        public boolean viaGroup() {
            return recipient.isGroup();
        }
    }

    /**
     * Snapshot of the recipient directory keyed by normalized name.
     */
    public static final class ResolutionIndex {

        private final Map<String, Recipient> customersByKey;
        private final Map<Long, Recipient> groupByMemberId;

        public ResolutionIndex(Map<String, Recipient> customersByKey, Map<Long, Recipient> groupByMemberId) {
            this.customersByKey = Map.copyOf(customersByKey);
            this.groupByMemberId = Map.copyOf(groupByMemberId);
        }

        public Optional<Resolution> resolve(String customerName) {
            String key = nameKey(customerName);
            if (key.isEmpty()) {
                return Optional.empty();
            }
            Recipient customer = customersByKey.get(key);
            if (customer == null) {
                return Optional.empty();
            }
            Recipient group = groupByMemberId.get(customer.getId());
            if (group != null && group.isActive()) {
                return Optional.of(new Resolution(group, customer));
            }
            if (customer.isActive()) {
                // A group's own name or alias routes straight to the group
                return Optional.of(new Resolution(customer, customer));
            }
            return Optional.empty();
        }
    }

    public ResolutionIndex buildIndex() {
        Map<String, Recipient> customersByKey = new HashMap<>();
        for (Recipient recipient : recipientRepository.findAll()) {
            customersByKey.put(nameKey(recipient.getName()), recipient);
        }
        // Aliases never shadow a recipient's own name
        for (RecipientAlias alias : aliasRepository.findAllWithRecipient()) {
            customersByKey.putIfAbsent(nameKey(alias.getCustomerName()), alias.getRecipient());
        }

        Map<Long, Recipient> groupByMemberId = new HashMap<>();
        for (GroupMembership membership : membershipRepository.findAllWithRecipients()) {
            if (membership.getGroup().isGroup()) {
                groupByMemberId.put(membership.getMember().getId(), membership.getGroup());
            }
        }
        return new ResolutionIndex(customersByKey, groupByMemberId);
    }

    public Optional<Resolution> resolve(String customerName) {
        return buildIndex().resolve(customerName);
    }

    static String nameKey(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
