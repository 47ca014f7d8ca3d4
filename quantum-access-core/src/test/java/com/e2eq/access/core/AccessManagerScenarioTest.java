package com.e2eq.access.core;

import com.e2eq.access.exceptions.ElementNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises a small organisation: sales, customer service, IT and managers, all rolled up into AllStaff.
 */
class AccessManagerScenarioTest {

    private static final String LIVIA = "Livia.Bowe@printweave.biz";
    private static final String ARJAN = "Arjan.Hartman@printweave.biz";
    private static final String CLEO = "Cleo.Short@printweave.biz";
    private static final String MAE = "Mae.Mellor@printweave.biz";
    private static final String FRANKIE = "Frankie.Koch@printweave.biz";
    private static final String DEBORAH = "Deborah.Moss@printweave.biz";
    private static final String KISHAN = "Kishan.Buchanan@printweave.biz";
    private static final String SEB = "Seb.Sutton@printweave.biz";
    private static final String BO = "Bo.Wagner@printweave.biz";
    private static final String TYE = "Tye.Knights@printweave.biz";

    private AccessManager<String, String, ApplicationScreen, AccessLevel> accessManager;

    @BeforeEach
    void setUp() {
        accessManager = new AccessManager<>();
        for (String user : new String[]{LIVIA, ARJAN, CLEO, MAE, FRANKIE, DEBORAH, KISHAN, SEB, BO, TYE}) {
            accessManager.addUser(user);
        }
        for (String group : new String[]{"Sales", "SalesManagers", "Managers", "IT", "CustomerService", "AllStaff"}) {
            accessManager.addGroup(group);
        }

        accessManager.addUserToGroupMapping(LIVIA, "Sales");
        accessManager.addUserToGroupMapping(ARJAN, "Sales");
        accessManager.addUserToGroupMapping(FRANKIE, "Sales");
        accessManager.addUserToGroupMapping(CLEO, "SalesManagers");
        accessManager.addUserToGroupMapping(MAE, "SalesManagers");
        accessManager.addUserToGroupMapping(DEBORAH, "CustomerService");
        accessManager.addUserToGroupMapping(KISHAN, "CustomerService");
        accessManager.addUserToGroupMapping(SEB, "IT");
        accessManager.addUserToGroupMapping(BO, "Managers");
        accessManager.addUserToGroupMapping(TYE, "Managers");

        accessManager.addGroupToGroupMapping("SalesManagers", "Sales");
        accessManager.addGroupToGroupMapping("Sales", "AllStaff");
        accessManager.addGroupToGroupMapping("Managers", "AllStaff");
        accessManager.addGroupToGroupMapping("IT", "AllStaff");
        accessManager.addGroupToGroupMapping("CustomerService", "AllStaff");

        accessManager.addGroupToComponentMapping("AllStaff", ApplicationScreen.ORDER_SUMMARY, AccessLevel.VIEW);
        accessManager.addGroupToComponentMapping("AllStaff", ApplicationScreen.CLIENT_INTERACTIONS, AccessLevel.VIEW);
        accessManager.addGroupToComponentMapping("Sales", ApplicationScreen.ORDER, AccessLevel.MODIFY);
        accessManager.addGroupToComponentMapping("SalesManagers", ApplicationScreen.PRODUCTS_SETUP, AccessLevel.MODIFY);
        accessManager.addGroupToComponentMapping("CustomerService", ApplicationScreen.CLIENT_INTERACTIONS, AccessLevel.MODIFY);
        accessManager.addGroupToComponentMapping("IT", ApplicationScreen.SYSTEM_SETTINGS, AccessLevel.MODIFY);

        accessManager.addEntityType("Clients");
        accessManager.addEntity("Clients", "CompanyA");
        accessManager.addEntity("Clients", "CompanyB");
        accessManager.addEntity("Clients", "CompanyC");
        accessManager.addEntityType("Products");
        accessManager.addEntity("Products", "PrintingMachines");
        accessManager.addEntity("Products", "WeavingMachines");

        accessManager.addUserToEntityMapping(LIVIA, "Products", "PrintingMachines");
        accessManager.addUserToEntityMapping(ARJAN, "Products", "PrintingMachines");
        accessManager.addUserToEntityMapping(CLEO, "Products", "PrintingMachines");
        accessManager.addUserToEntityMapping(FRANKIE, "Products", "WeavingMachines");
        accessManager.addUserToEntityMapping(MAE, "Products", "WeavingMachines");
        accessManager.addUserToEntityMapping(DEBORAH, "Clients", "CompanyA");
        accessManager.addUserToEntityMapping(DEBORAH, "Clients", "CompanyB");
        accessManager.addUserToEntityMapping(KISHAN, "Clients", "CompanyA");
        accessManager.addUserToEntityMapping(KISHAN, "Clients", "CompanyB");
        accessManager.addUserToEntityMapping(KISHAN, "Clients", "CompanyC");
    }

    @Test
    void testProductsSetupLimitedToSalesManagers() {
        assertTrue(accessManager.hasAccessToComponent(MAE, ApplicationScreen.PRODUCTS_SETUP, AccessLevel.MODIFY));
        assertFalse(accessManager.hasAccessToComponent(LIVIA, ApplicationScreen.PRODUCTS_SETUP, AccessLevel.MODIFY));
    }

    @Test
    void testSalesManagersInheritSalesAndAllStaff() {
        assertTrue(accessManager.hasAccessToComponent(CLEO, ApplicationScreen.ORDER, AccessLevel.MODIFY));
        assertTrue(accessManager.hasAccessToComponent(CLEO, ApplicationScreen.ORDER_SUMMARY, AccessLevel.VIEW));
        assertFalse(accessManager.hasAccessToComponent(CLEO, ApplicationScreen.SYSTEM_SETTINGS, AccessLevel.MODIFY));
        assertTrue(accessManager.hasAccessToComponent(SEB, ApplicationScreen.SYSTEM_SETTINGS, AccessLevel.MODIFY));
        assertFalse(accessManager.hasAccessToComponent(BO, ApplicationScreen.ORDER, AccessLevel.MODIFY));
    }

    @Test
    void testProductEntities() {
        assertTrue(accessManager.hasAccessToEntity(FRANKIE, "Products", "WeavingMachines"));
        assertFalse(accessManager.hasAccessToEntity(ARJAN, "Products", "WeavingMachines"));
    }

    @Test
    void testViewableClients() {
        assertEquals(Set.of("CompanyA", "CompanyB", "CompanyC"), accessManager.getAccessibleEntities(KISHAN, "Clients"));
        assertEquals(Set.of("CompanyA", "CompanyB"), accessManager.getAccessibleEntities(DEBORAH, "Clients"));
        assertTrue(accessManager.getAccessibleEntities(SEB, "Clients").isEmpty());
    }

    @Test
    void testRemovingAllStaff() {
        assertTrue(accessManager.hasAccessToComponent(TYE, ApplicationScreen.ORDER_SUMMARY, AccessLevel.VIEW));

        accessManager.removeGroup("AllStaff");

        assertFalse(accessManager.hasAccessToComponent(TYE, ApplicationScreen.ORDER_SUMMARY, AccessLevel.VIEW));
        assertFalse(accessManager.hasAccessToComponent(LIVIA, ApplicationScreen.CLIENT_INTERACTIONS, AccessLevel.VIEW));
        assertTrue(accessManager.hasAccessToComponent(KISHAN, ApplicationScreen.CLIENT_INTERACTIONS, AccessLevel.MODIFY));
        assertTrue(accessManager.getGroupToGroupMappings("Sales").isEmpty());
        assertThrows(ElementNotFoundException.class, () -> accessManager.addGroupToGroupMapping("Sales", "AllStaff"));
    }
}
