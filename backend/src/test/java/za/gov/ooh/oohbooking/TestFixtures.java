package za.gov.ooh.oohbooking;

import com.jayway.jsonpath.JsonPath;
import java.io.UnsupportedEncodingException;
import java.util.UUID;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.web.servlet.MvcResult;
import za.gov.ooh.oohbooking.security.Role;
import za.gov.ooh.oohbooking.supplier.Supplier;
import za.gov.ooh.oohbooking.supplier.SupplierRepository;
import za.gov.ooh.oohbooking.user.AppUser;
import za.gov.ooh.oohbooking.user.AppUserRepository;

/** Shared setup for MockMvc integration tests. Usernames must be unique across test classes. */
public final class TestFixtures {

  public static final String PASSWORD = "test-password";
  public static final String USER_ID_HEADER = "user-id";

  private TestFixtures() {}

  public static UUID createUser(
      AppUserRepository userRepository,
      PasswordEncoder passwordEncoder,
      String username,
      Role role,
      UUID supplierId) {
    return userRepository
        .save(
            new AppUser(
                username,
                passwordEncoder.encode(PASSWORD),
                username + " Test",
                username + "@test.gov.za",
                role,
                supplierId))
        .getId();
  }

  public static UUID createSupplier(SupplierRepository supplierRepository, String name) {
    return supplierRepository
        .save(new Supplier(name, "Contact " + name, "contact@" + name + ".co.za", null, null))
        .getId();
  }

  public static String idOf(MvcResult result) throws UnsupportedEncodingException {
    return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }
}
