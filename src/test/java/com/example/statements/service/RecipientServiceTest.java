package com.example.statements.service;

import com.example.statements.domain.GroupMembership;
import com.example.statements.domain.Recipient;
import com.example.statements.domain.Recipient.Frequency;
import com.example.statements.domain.Recipient.Kind;
import com.example.statements.domain.TermsCode;
import com.example.statements.repository.GroupMembershipRepository;
import com.example.statements.repository.RecipientAliasRepository;
import com.example.statements.repository.RecipientRepository;
import com.example.statements.service.RecipientService.RecipientDetails;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RecipientService administration.
 */
@ExtendWith(MockitoExtension.class)
class RecipientServiceTest {

    @Mock
    private RecipientRepository recipientRepository;

    @Mock
    private RecipientAliasRepository aliasRepository;

    @Mock
    private GroupMembershipRepository membershipRepository;

    private RecipientService recipientService;

    @BeforeEach
    void setUp() {
        recipientService = new RecipientService(recipientRepository, aliasRepository, membershipRepository);
    }

    @Test
    void create_ValidDetails_NormalizesAndSaves() {
        // Given
        RecipientDetails details = new RecipientDetails(" Acme Corp ", "ap@acme.example; owner@acme.example",
            "Net 15", null, "biweekly", 9, 31, true);
        when(recipientRepository.findByNameIgnoreCase("Acme Corp")).thenReturn(Optional.empty());
        when(recipientRepository.save(any(Recipient.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        Recipient recipient = recipientService.create(Kind.SINGLE, details);

        // Then
        assertEquals("Acme Corp", recipient.getName());
        assertEquals("ap@acme.example, owner@acme.example", recipient.getEmailTo());
        assertEquals(TermsCode.NET_15, recipient.getTermsCode());
        assertEquals(Frequency.BIWEEKLY, recipient.getFrequency());
        assertEquals(6, recipient.getDayOfWeek());
        assertEquals(28, recipient.getDayOfMonth());
    }

    @Test
    void create_NameTakenIgnoringCase_Rejected() {
        // Given
        Recipient existing = new Recipient("ACME CORP", Kind.SINGLE, "x@acme.example", TermsCode.NET_30);
        when(recipientRepository.findByNameIgnoreCase("Acme Corp")).thenReturn(Optional.of(existing));

        // When / Then
        assertThrows(IllegalArgumentException.class, () -> recipientService.create(Kind.GROUP,
            new RecipientDetails("Acme Corp", "ap@acme.example", null, null, null, null, null, true)));
        verify(recipientRepository, never()).save(any());
    }

    @Test
    void create_MissingEmail_Rejected() {
        // Given
        when(recipientRepository.findByNameIgnoreCase("Acme Corp")).thenReturn(Optional.empty());

        // When / Then
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> recipientService.create(
            Kind.SINGLE, new RecipientDetails("Acme Corp", " ; ", null, null, null, null, null, true)));
        assertEquals("Name and email are required", ex.getMessage());
    }

    @Test
    void update_RenameToOwnNameDifferentCase_Allowed() {
        // Given
        Recipient acme = new Recipient("Acme Corp", Kind.SINGLE, "ap@acme.example", TermsCode.NET_30);
        acme.setId(1L);
        when(recipientRepository.findById(1L)).thenReturn(Optional.of(acme));
        when(recipientRepository.findByNameIgnoreCase("ACME Corp")).thenReturn(Optional.of(acme));
        when(recipientRepository.save(acme)).thenReturn(acme);

        // When
        Recipient updated = recipientService.update(1L,
            new RecipientDetails("ACME Corp", "ap@acme.example", "cod", null, "none", null, null, false));

        // Then
        assertEquals("ACME Corp", updated.getName());
        assertEquals(TermsCode.COD, updated.getTermsCode());
        assertEquals(Frequency.NONE, updated.getFrequency());
        assertFalse(updated.isActive());
    }

    @Test
    void setGroupMembers_MovesMembersAndIgnoresGroups() {
        // Given
        Recipient group = recipient(10L, "Acme Group", Kind.GROUP);
        Recipient oldGroup = recipient(11L, "Old Group", Kind.GROUP);
        Recipient store1 = recipient(1L, "Acme Store 1", Kind.SINGLE);
        Recipient nested = recipient(12L, "Nested Group", Kind.GROUP);
        GroupMembership previous = new GroupMembership(oldGroup, store1);

        when(recipientRepository.findById(10L)).thenReturn(Optional.of(group));
        when(recipientRepository.findAllById(any())).thenReturn(List.of(store1, nested));
        when(membershipRepository.findByMember(store1)).thenReturn(Optional.of(previous));

        // When
        List<Recipient> members = recipientService.setGroupMembers(10L, List.of(1L, 12L));

        // Then
        assertEquals(List.of(store1), members);
        InOrder inOrder = inOrder(membershipRepository);
        inOrder.verify(membershipRepository).deleteByGroup(group);
        inOrder.verify(membershipRepository).delete(previous);
        inOrder.verify(membershipRepository).flush();
        ArgumentCaptor<GroupMembership> captor = ArgumentCaptor.forClass(GroupMembership.class);
        inOrder.verify(membershipRepository).save(captor.capture());
        assertSame(group, captor.getValue().getGroup());
        assertSame(store1, captor.getValue().getMember());
    }

    @Test
    void setGroupMembers_NotAGroup_Rejected() {
        // Given
        when(recipientRepository.findById(1L)).thenReturn(Optional.of(recipient(1L, "Acme Store 1", Kind.SINGLE)));

        // When / Then
        assertThrows(IllegalArgumentException.class, () -> recipientService.setGroupMembers(1L, List.of(2L)));
        verifyNoInteractions(membershipRepository);
    }

    @Test
    void delete_RemovesMembershipsAndAliases() {
        // Given
        Recipient acme = recipient(1L, "Acme Corp", Kind.SINGLE);
        when(recipientRepository.findById(1L)).thenReturn(Optional.of(acme));

        // When
        recipientService.delete(1L);

        // Then
        verify(membershipRepository).deleteByGroup(acme);
        verify(membershipRepository).deleteByMember(acme);
        verify(aliasRepository).deleteByRecipient(acme);
        verify(recipientRepository).delete(acme);
    }

    @Test
    void addAlias_BlankName_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> recipientService.addAlias("  ", 1L));
        verifyNoInteractions(aliasRepository);
    }

    private Recipient recipient(Long id, String name, Kind kind) {
        Recipient recipient = new Recipient(name, kind, "ap@example.com", TermsCode.NET_30);
        recipient.setId(id);
        return recipient;
    }
}
