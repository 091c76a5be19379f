package io.avalonrest.example;

import io.avalonrest.core.AvalonRestException;
import io.avalonrest.core.HttpMethod;
import io.avalonrest.server.core.ActionResult;
import io.avalonrest.server.core.ControllerBase;
import io.avalonrest.server.core.annotation.Authorize;
import io.avalonrest.server.core.annotation.Controller;
import io.avalonrest.server.core.annotation.DefaultValue;
import io.avalonrest.server.core.annotation.FromBody;
import io.avalonrest.server.core.annotation.FromQuery;
import io.avalonrest.server.core.annotation.Route;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

@Controller
public class UserController extends ControllerBase {

    public static final class Registration {
        public String name;
        public String email;
        public int age;
    }

    public record User(int id, String name, String email, int age) {}

    /** Users of the sample application; shared by every request. */
    public static final class Directory {
        private final Map<Integer, User> users = new ConcurrentHashMap<>();
        private final AtomicInteger ids = new AtomicInteger();

        User add(String name, String email, int age) {
            User user = new User(ids.incrementAndGet(), name, email, age);
            users.put(user.id(), user);
            return user;
        }

        User find(int id) {
            return users.get(id);
        }

        List<User> page(int skip, int take) {
            List<User> all = new ArrayList<>(users.values());
            all.sort((a, b) -> Integer.compare(a.id(), b.id()));
            int from = Math.min(Math.max(skip, 0), all.size());
            int to = Math.min(from + Math.max(take, 0), all.size());
            return all.subList(from, to);
        }
    }

    private final Directory directory;

    public UserController(Directory directory) {
        this.directory = directory;
    }

    @Route(path = "info")
    public Map<String, Object> info() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("service", "users");
        out.put("authenticated", context().isAuthenticated());
        out.put("clientIp", context().clientIp());
        return out;
    }

    @Route
    public List<User> list(@FromQuery @DefaultValue("0") int skip, @FromQuery @DefaultValue("20") int take) {
        return directory.page(skip, take);
    }

    @Route(path = "{id}")
    public User byId(int id) {
        User user = directory.find(id);
        if (user == null) {
            throw new AvalonRestException.NotFound("User " + id + " not found");
        }
        return user;
    }

    @Route(method = HttpMethod.POST, path = "register")
    public ActionResult register(@FromBody Registration registration) {
        if (registration.name == null || registration.name.isBlank()) {
            return badRequest("Name is required");
        }
        if (registration.email == null || !registration.email.contains("@")) {
            return badRequest("A valid email is required");
        }
        return created(directory.add(registration.name.trim(), registration.email.trim(), registration.age));
    }

    @Route(path = "me")
    @Authorize
    public Map<String, Object> me() {
        var identity = user().orElseThrow();
        return Map.of("name", identity.name(), "roles", identity.roles());
    }
}
