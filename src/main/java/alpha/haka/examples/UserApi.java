package alpha.haka.examples;

import alpha.haka.message.JsonMessage;
import alpha.haka.route.Router;

import java.util.List;

/**
 * A standalone router of user endpoints, meant to be mounted under a prefix of
 * another router.
 * 
 * @see HakaDemo
 */
public final class UserApi
{
    private UserApi() {
        // Empty
    }
    
    /**
     * A user.
     */
    static final class User {
        final int id;
        final String name;
        
        User(int id, String name) {
            this.id = id;
            this.name = name;
        }
    }
    
    /**
     * Creates the router.<p>
     * 
     * Routes:
     * <ul>
     *   <li>GET /list - all users</li>
     *   <li>GET /profile - a profile message</li>
     * </ul>
     * 
     * @return a new router
     */
    public static Router createRouter() {
        Router users = Router.create();
        
        users.get("/list", (req, res) -> res.json(List.of(
                new User(1, "Alice"),
                new User(2, "Bob"),
                new User(3, "Charlie"))));
        
        users.get("/profile", (req, res) -> res.json(new JsonMessage(
                "User Profile",
                "User profile details from the modular router.")));
        
        return users;
    }
}
